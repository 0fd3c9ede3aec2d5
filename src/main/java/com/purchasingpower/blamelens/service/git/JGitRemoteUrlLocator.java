package com.purchasingpower.blamelens.service.git;

import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.lib.StoredConfig;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class JGitRemoteUrlLocator implements RemoteUrlLocator {

    private static final String REMOTE_SECTION = "remote";
    private static final String ORIGIN = "origin";

    private final Set<Path> knownRepositories = ConcurrentHashMap.newKeySet();

    @Override
    public Optional<String> findRemoteUrl(Path file) {
        File start = startDirectory(file).toFile();
        FileRepositoryBuilder builder = new FileRepositoryBuilder().findGitDir(start);
        if (builder.getGitDir() == null) {
            log.debug("{} is not inside a git repository", file);
            return Optional.empty();
        }

        try (Repository repository = builder.setMustExist(true).build()) {
            knownRepositories.add(repository.getDirectory().toPath().toAbsolutePath().normalize());

            StoredConfig config = repository.getConfig();
            String url = config.getString(REMOTE_SECTION, ORIGIN, "url");
            if (url == null || url.isBlank()) {
                url = config.getString(REMOTE_SECTION, ORIGIN, "pushurl");
            }
            if (url == null || url.isBlank()) {
                log.debug("Repository {} has no origin remote", repository.getDirectory());
                return Optional.empty();
            }
            return Optional.of(url.trim());
        } catch (IOException e) {
            log.warn("Failed to open repository at {}: {}", builder.getGitDir(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Set<Path> getKnownRepositories() {
        return Collections.unmodifiableSet(knownRepositories);
    }

    private static Path startDirectory(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (Files.isDirectory(absolute)) {
            return absolute;
        }
        Path parent = absolute.getParent();
        return parent != null ? parent : absolute;
    }
}
