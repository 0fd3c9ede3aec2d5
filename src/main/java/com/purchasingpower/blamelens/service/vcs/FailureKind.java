package com.purchasingpower.blamelens.service.vcs;

/**
 * Why a provider could not answer.
 */
public enum FailureKind {
    NO_CREDENTIAL,
    INVALID_CREDENTIAL,
    RATE_LIMITED,
    NOT_FOUND,
    NETWORK_ERROR,
    UNKNOWN;

    public boolean isCredentialProblem() {
        return this == NO_CREDENTIAL || this == INVALID_CREDENTIAL;
    }
}
