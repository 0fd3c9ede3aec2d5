package com.purchasingpower.blamelens.model.blame;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * The commit that last touched one line of a file's current revision.
 *
 * <p>{@code lineNumber} is the 1-based line in the current buffer, not the line the
 * content had when the commit introduced it.
 */
@Value
@Builder(toBuilder = true)
public class LineAttribution {

    public static final String UNKNOWN_AUTHOR = "Unknown";

    String commitId;

    @Builder.Default
    String author = UNKNOWN_AUTHOR;

    @Builder.Default
    String authorEmail = "";

    @Builder.Default
    Instant timestamp = Instant.EPOCH;

    @Builder.Default
    String summary = "";

    int lineNumber;
}
