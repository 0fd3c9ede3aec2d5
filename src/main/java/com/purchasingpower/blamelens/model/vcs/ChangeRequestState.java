package com.purchasingpower.blamelens.model.vcs;

public enum ChangeRequestState {
    MERGED,
    OPEN,
    CLOSED
}
