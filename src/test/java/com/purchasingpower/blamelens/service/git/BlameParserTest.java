package com.purchasingpower.blamelens.service.git;

import com.purchasingpower.blamelens.model.blame.LineAttribution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Blame Parser Tests")
class BlameParserTest {

    private static final String ALICE = "a1b2c3d4e5f6a7b8c9d0a1b2c3d4e5f6a7b8c9d0";
    private static final String BOB = "0f1e2d3c4b5a69788796a5b4c3d2e1f0a9b8c7d6";
    private static final String UNCOMMITTED = "0000000000000000000000000000000000000000";

    private BlameParser parser;

    @BeforeEach
    void setUp() {
        parser = new BlameParser();
    }

    @Test
    @DisplayName("Should parse porcelain output and drop uncommitted lines")
    void testParsePorcelain_ShouldKeepOnlyCommittedLines() {
        // Given: 3 committed lines and one uncommitted block
        String porcelain = String.join("\n",
                ALICE + " 1 1 2",
                "author Alice Example",
                "author-mail <alice@example.com>",
                "author-time 1700000000",
                "author-tz +0100",
                "committer Alice Example",
                "committer-mail <alice@example.com>",
                "committer-time 1700000000",
                "committer-tz +0100",
                "summary Initial import",
                "filename src/App.java",
                "\tpublic class App {",
                ALICE + " 2 2",
                "\t    int x;",
                UNCOMMITTED + " 3 3 1",
                "author Not Committed Yet",
                "author-mail <not.committed.yet>",
                "author-time 1700000500",
                "author-tz +0000",
                "summary Version of src/App.java from src/App.java",
                "filename src/App.java",
                "\t    int y;",
                BOB + " 3 4 1",
                "author Bob",
                "author-mail <bob@example.com>",
                "author-time 1710000000",
                "author-tz -0500",
                "summary Close class",
                "previous " + ALICE + " src/App.java",
                "filename src/App.java",
                "\t}",
                "");

        // When
        Map<Integer, LineAttribution> result = parser.parse(porcelain);

        // Then
        assertEquals(3, result.size(), "Uncommitted line 3 must be excluded");
        assertThat(result).containsOnlyKeys(1, 2, 4);

        LineAttribution first = result.get(1);
        assertEquals(ALICE, first.getCommitId());
        assertEquals("Alice Example", first.getAuthor());
        assertEquals("alice@example.com", first.getAuthorEmail());
        assertEquals(Instant.ofEpochSecond(1700000000L), first.getTimestamp());
        assertEquals("Initial import", first.getSummary());
        assertEquals(1, first.getLineNumber());

        // Line 2 has no metadata of its own; it is inherited from the first record of the commit
        LineAttribution second = result.get(2);
        assertEquals(ALICE, second.getCommitId());
        assertEquals("Alice Example", second.getAuthor());
        assertEquals("Initial import", second.getSummary());

        LineAttribution fourth = result.get(4);
        assertEquals(BOB, fourth.getCommitId());
        assertEquals("bob@example.com", fourth.getAuthorEmail());
        assertEquals(4, fourth.getLineNumber(), "Key is the final line, not the original one");
    }

    @Test
    @DisplayName("Should parse standard blame output")
    void testParseStandard_ShouldExtractAuthorAndTimestamp() {
        // Given
        String standard = String.join("\n",
                "d01a7c049 (Jane Doe         2025-07-09 17:57:39 +0200   1) import {",
                "^abc1234  (Another Author   2024-01-15 10:30:00 +0000   2) const x = 1;",
                "00000000 (Not Committed Yet 2025-07-10 09:00:00 +0000   3) dirty();");

        // When
        Map<Integer, LineAttribution> result = parser.parse(standard);

        // Then
        assertEquals(2, result.size());

        LineAttribution first = result.get(1);
        assertEquals("d01a7c049", first.getCommitId());
        assertEquals("Jane Doe", first.getAuthor());
        assertEquals(Instant.parse("2025-07-09T15:57:39Z"), first.getTimestamp());
        assertEquals("", first.getAuthorEmail());
        assertEquals("", first.getSummary());

        LineAttribution boundary = result.get(2);
        assertEquals("abc1234", boundary.getCommitId(), "Boundary marker is stripped");
        assertEquals("Another Author", boundary.getAuthor());
    }

    @Test
    @DisplayName("Should strip boundary marker from porcelain headers")
    void testParsePorcelain_BoundaryHeader() {
        // Given
        String porcelain = String.join("\n",
                "^" + BOB + " 7 7 1",
                "author Bob",
                "boundary",
                "filename a.txt",
                "\ttext");

        // When
        Map<Integer, LineAttribution> result = parser.parse(porcelain);

        // Then
        assertEquals(BOB, result.get(7).getCommitId());
    }

    @Test
    @DisplayName("Should apply defaults when metadata is missing")
    void testParsePorcelain_MissingMetadataUsesDefaults() {
        // Given: record with no tags at all
        String porcelain = BOB + " 1 1 1\n\tcontent";

        // When
        LineAttribution attribution = parser.parse(porcelain).get(1);

        // Then
        assertNotNull(attribution);
        assertEquals(LineAttribution.UNKNOWN_AUTHOR, attribution.getAuthor());
        assertEquals("", attribution.getAuthorEmail());
        assertEquals("", attribution.getSummary());
        assertEquals(Instant.EPOCH, attribution.getTimestamp());
    }

    @Test
    @DisplayName("Should drop truncated records without throwing")
    void testParsePorcelain_TruncatedRecord() {
        // Given: the second record never gets its content line
        String porcelain = String.join("\n",
                ALICE + " 1 1 1",
                "author Alice",
                "\tline one",
                BOB + " 2 2 1",
                "author Bob",
                "summary Cut off here");

        // When
        Map<Integer, LineAttribution> result = parser.parse(porcelain);

        // Then
        assertEquals(1, result.size());
        assertTrue(result.containsKey(1));
    }

    @Test
    @DisplayName("Should skip garbage and handle CRLF and empty input")
    void testParse_GarbageAndEdgeCases() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse("fatal: no such path 'x' in HEAD\nnot blame output").isEmpty());

        String crlf = ALICE + " 1 1 1\r\nauthor Alice\r\nsummary Windows\r\n\tline\r\n";
        LineAttribution attribution = parser.parse(crlf).get(1);
        assertEquals("Alice", attribution.getAuthor());
        assertEquals("Windows", attribution.getSummary());
    }
}
