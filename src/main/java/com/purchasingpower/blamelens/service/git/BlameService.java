package com.purchasingpower.blamelens.service.git;

import com.purchasingpower.blamelens.exception.BlameCommandException;
import com.purchasingpower.blamelens.model.blame.LineAttribution;
import com.purchasingpower.blamelens.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Line attribution lookups. A file that cannot be blamed (untracked, outside a repository,
 * git missing) simply has no attributions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlameService {

    private final BlameTextSource blameTextSource;
    private final BlameParser blameParser;

    public Map<Integer, LineAttribution> getAttributionsForFile(Path file) {
        try {
            return blameParser.parse(blameTextSource.blame(file));
        } catch (BlameCommandException e) {
            log.warn("Blame unavailable for {}: {} {}", file, e.getMessage(),
                    ExternalCallLogger.truncate(e.getErrorLogs(), 300));
            return Collections.emptyMap();
        } catch (RuntimeException e) {
            log.error("Unexpected failure while blaming {}", file, e);
            return Collections.emptyMap();
        }
    }

    /**
     * @param lineNumber 1-based line in the current file
     */
    public Optional<LineAttribution> getAttributionForLine(Path file, int lineNumber) {
        if (lineNumber < 1) {
            return Optional.empty();
        }
        return Optional.ofNullable(getAttributionsForFile(file).get(lineNumber));
    }
}
