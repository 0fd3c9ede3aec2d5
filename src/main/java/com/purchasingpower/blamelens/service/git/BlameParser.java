package com.purchasingpower.blamelens.service.git;

import com.purchasingpower.blamelens.model.blame.LineAttribution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code git blame} output into a map of current line number to {@link LineAttribution}.
 *
 * <p>Two layouts are understood, and may even be mixed:
 * <ul>
 *   <li><b>Porcelain</b> ({@code --porcelain} / {@code --line-porcelain}):
 *   <pre>
 *   d01a7c0492...e1 12 14 3
 *   author Jane Doe
 *   author-mail &lt;jane@example.com&gt;
 *   author-time 1720540659
 *   author-tz +0200
 *   summary Fix token refresh
 *   filename src/auth.ts
 *   	const token = refresh();
 *   </pre>
 *   The header holds the commit id, original line, final line and optional group size. Metadata is
 *   only printed the first time a commit shows up in plain porcelain, so it is remembered per commit.
 *   A TAB-prefixed content line closes the record.</li>
 *   <li><b>Standard</b>:
 *   <pre>
 *   d01a7c049 (Jane Doe         2025-07-09 17:57:39 +0200   1) import {
 *   ^abc1234  (Another Author   2024-01-15 10:30:00 +0000  42) const x = 1;
 *   </pre></li>
 * </ul>
 *
 * <p>Lines attributed to the all-zero id (uncommitted changes) are left out. A leading {@code ^}
 * (boundary commit) is stripped. Nothing here throws: lines that cannot be parsed are skipped and
 * whatever could be parsed is returned.
 */
@Slf4j
@Component
public class BlameParser {

    private static final Pattern PORCELAIN_HEADER =
            Pattern.compile("^\\^?([0-9a-f]{7,64}) (\\d+) (\\d+)(?: (\\d+))?$");

    // Groups: id, author, date, time, timezone, final line
    private static final Pattern STANDARD_LINE = Pattern.compile(
            "^\\^?([0-9a-f]+)\\s+(?:\\S+\\s+)?\\((.+?)\\s+(\\d{4}-\\d{2}-\\d{2})\\s+(\\d{2}:\\d{2}:\\d{2})\\s+([+-]\\d{4})\\s+(\\d+)\\)\\s?.*$");

    private static final Pattern UNCOMMITTED_ID = Pattern.compile("^0+$");

    public Map<Integer, LineAttribution> parse(String blameOutput) {
        Map<Integer, LineAttribution> result = new TreeMap<>();
        if (blameOutput == null || blameOutput.isEmpty()) {
            return result;
        }

        Map<String, CommitMetadata> metadataByCommit = new HashMap<>();
        String pendingCommit = null;
        int pendingLine = -1;
        int skipped = 0;

        for (String rawLine : blameOutput.split("\n", -1)) {
            String line = stripCarriageReturn(rawLine);

            if (line.startsWith("\t")) {
                if (pendingCommit != null) {
                    emit(result, pendingCommit, pendingLine, metadataByCommit.get(pendingCommit));
                    pendingCommit = null;
                }
                continue;
            }

            Matcher header = PORCELAIN_HEADER.matcher(line);
            if (header.matches()) {
                // a header without content line before it means the previous record was truncated
                pendingCommit = header.group(1);
                pendingLine = parseLineNumber(header.group(3));
                metadataByCommit.computeIfAbsent(pendingCommit, id -> new CommitMetadata());
                continue;
            }

            if (pendingCommit != null) {
                applyTag(metadataByCommit.get(pendingCommit), line);
                continue;
            }

            Matcher standard = STANDARD_LINE.matcher(line);
            if (standard.matches()) {
                if (!emitStandard(result, standard)) {
                    skipped++;
                }
            } else if (!line.isBlank()) {
                skipped++;
            }
        }

        if (skipped > 0) {
            log.debug("Skipped {} unparseable blame lines", skipped);
        }
        return result;
    }

    private void emit(Map<Integer, LineAttribution> result, String commitId, int lineNumber, CommitMetadata metadata) {
        if (lineNumber <= 0 || UNCOMMITTED_ID.matcher(commitId).matches()) {
            return;
        }
        CommitMetadata meta = metadata != null ? metadata : new CommitMetadata();
        result.put(lineNumber, LineAttribution.builder()
                .commitId(commitId)
                .author(orUnknown(meta.author))
                .authorEmail(meta.authorEmail != null ? meta.authorEmail : "")
                .timestamp(meta.authorTime != null ? meta.authorTime : Instant.EPOCH)
                .summary(meta.summary != null ? meta.summary : "")
                .lineNumber(lineNumber)
                .build());
    }

    private boolean emitStandard(Map<Integer, LineAttribution> result, Matcher match) {
        String commitId = match.group(1);
        int lineNumber = parseLineNumber(match.group(6));
        if (lineNumber <= 0) {
            return false;
        }
        if (UNCOMMITTED_ID.matcher(commitId).matches()) {
            return true;
        }

        Instant timestamp;
        try {
            timestamp = OffsetDateTime.of(
                    LocalDate.parse(match.group(3)),
                    LocalTime.parse(match.group(4)),
                    ZoneOffset.of(match.group(5))).toInstant();
        } catch (DateTimeException e) {
            return false;
        }

        result.put(lineNumber, LineAttribution.builder()
                .commitId(commitId)
                .author(orUnknown(match.group(2)))
                .timestamp(timestamp)
                .lineNumber(lineNumber)
                .build());
        return true;
    }

    private void applyTag(CommitMetadata metadata, String line) {
        int space = line.indexOf(' ');
        String tag = space < 0 ? line : line.substring(0, space);
        String value = space < 0 ? "" : line.substring(space + 1);

        switch (tag) {
            case "author" -> metadata.author = value;
            case "author-mail" -> metadata.authorEmail = stripAngleBrackets(value);
            case "author-time" -> metadata.authorTime = parseEpochSeconds(value);
            case "summary" -> metadata.summary = value;
            default -> {
                // committer*, author-tz, previous, boundary, filename: not needed
            }
        }
    }

    private static int parseLineNumber(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static Instant parseEpochSeconds(String value) {
        try {
            return Instant.ofEpochSecond(Long.parseLong(value.trim()));
        } catch (NumberFormatException | DateTimeException e) {
            return null;
        }
    }

    private static String stripAngleBrackets(String value) {
        String trimmed = value.trim();
        if (trimmed.startsWith("<") && trimmed.endsWith(">")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String orUnknown(String author) {
        if (author == null || author.isBlank()) {
            return LineAttribution.UNKNOWN_AUTHOR;
        }
        return author.trim();
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static final class CommitMetadata {
        private String author;
        private String authorEmail;
        private Instant authorTime;
        private String summary;
    }
}
