package com.purchasingpower.blamelens.exception;

import lombok.Getter;

/**
 * {@code git blame} could not be run or exited with an error. Carries whatever the process
 * wrote to stderr.
 */
@Getter
public class BlameCommandException extends RuntimeException {

    private final String errorLogs;

    public BlameCommandException(String message, String errorLogs) {
        super(message);
        this.errorLogs = errorLogs;
    }

    public BlameCommandException(String message, Throwable cause) {
        super(message, cause);
        this.errorLogs = "";
    }
}
