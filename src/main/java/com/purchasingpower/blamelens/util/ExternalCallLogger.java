package com.purchasingpower.blamelens.util;

import com.purchasingpower.blamelens.model.CallContext;
import com.purchasingpower.blamelens.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging for calls to hosting provider APIs and the git executable.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (commit messages, process output)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * Abbreviate a commit id to the conventional 8 characters.
     */
    public static String shortSha(String commitId) {
        if (commitId == null) {
            return "(null)";
        }
        return commitId.length() <= 8 ? commitId : commitId.substring(0, 8);
    }
}
