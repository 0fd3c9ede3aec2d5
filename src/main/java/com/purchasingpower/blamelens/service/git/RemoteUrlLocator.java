package com.purchasingpower.blamelens.service.git;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the remote a file's repository was cloned from.
 */
public interface RemoteUrlLocator {

    /**
     * @return the origin fetch URL, falling back to its push URL; empty if the file is not in a
     * repository or the repository has no origin
     */
    Optional<String> findRemoteUrl(Path file);

    /**
     * Git directories of every repository a lookup has touched so far.
     */
    Set<Path> getKnownRepositories();
}
