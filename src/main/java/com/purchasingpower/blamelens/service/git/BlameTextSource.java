package com.purchasingpower.blamelens.service.git;

import java.nio.file.Path;

/**
 * Produces raw line-attribution text for a file, in either layout {@link BlameParser} reads.
 */
public interface BlameTextSource {

    /**
     * @throws com.purchasingpower.blamelens.exception.BlameCommandException if blame could not be produced
     */
    String blame(Path file);
}
