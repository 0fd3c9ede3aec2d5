package com.purchasingpower.blamelens.model.vcs;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A merge request (GitLab) or pull request (GitHub), independent of the host that serves it.
 */
@Value
@Builder(toBuilder = true)
public class ChangeRequest {

    /** GitLab {@code iid} or GitHub {@code number}. */
    long number;

    String title;

    String url;

    /** Null when the change request was never merged. */
    Instant mergedAt;

    ChangeRequestState state;

    /** Null until loaded on demand. */
    ChangeRequestStats stats;

    public boolean isMerged() {
        return state == ChangeRequestState.MERGED && mergedAt != null;
    }

    public ChangeRequest withStats(ChangeRequestStats stats) {
        return toBuilder().stats(stats).build();
    }
}
