package com.purchasingpower.blamelens.service.git;

import com.purchasingpower.blamelens.exception.BlameCommandException;
import com.purchasingpower.blamelens.model.blame.LineAttribution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Blame Service Tests")
class BlameServiceTest {

    private static final Path FILE = Path.of("/work/repo/README.md");
    private static final String COMMIT = "c0ffee00c0ffee00c0ffee00c0ffee00c0ffee00";

    @Test
    @DisplayName("Should look up the attribution of a single line")
    void testGetAttributionForLine() {
        // Given
        BlameService service = new BlameService(
                file -> COMMIT + " 1 1 1\nauthor Carol\nsummary Docs\n\t# Title\n", new BlameParser());

        // When
        Optional<LineAttribution> line1 = service.getAttributionForLine(FILE, 1);

        // Then
        assertEquals("Carol", line1.orElseThrow().getAuthor());
        assertTrue(service.getAttributionForLine(FILE, 2).isEmpty());
        assertTrue(service.getAttributionForLine(FILE, 0).isEmpty());
    }

    @Test
    @DisplayName("Should degrade to no attributions when git fails")
    void testGitFailureIsEmpty() {
        BlameService failing = new BlameService(file -> {
            throw new BlameCommandException("git blame exited with code 128", "fatal: no such path");
        }, new BlameParser());
        BlameService broken = new BlameService(file -> {
            throw new IllegalStateException("unexpected");
        }, new BlameParser());

        assertTrue(failing.getAttributionsForFile(FILE).isEmpty());
        assertTrue(failing.getAttributionForLine(FILE, 1).isEmpty());
        assertTrue(broken.getAttributionsForFile(FILE).isEmpty());
    }
}
