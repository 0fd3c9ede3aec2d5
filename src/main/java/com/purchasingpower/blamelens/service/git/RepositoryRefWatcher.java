package com.purchasingpower.blamelens.service.git;

import com.purchasingpower.blamelens.event.RepositoryMutationEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Polls the refs of every repository seen by {@link RemoteUrlLocator} and publishes a
 * {@link RepositoryMutationEvent} when HEAD or any ref moves (checkout, commit, fetch, pull).
 *
 * The first observation of a repository only records its state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.repository-watch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RepositoryRefWatcher {

    private final RemoteUrlLocator remoteUrlLocator;
    private final ApplicationEventPublisher eventPublisher;

    private final Map<Path, String> fingerprints = new ConcurrentHashMap<>();

    @Scheduled(fixedDelayString = "${app.repository-watch.interval-ms:5000}")
    public void checkForChanges() {
        for (Path gitDir : remoteUrlLocator.getKnownRepositories()) {
            try {
                RepositoryState state = readState(gitDir);
                String previous = fingerprints.put(gitDir, state.fingerprint());
                if (previous != null && !previous.equals(state.fingerprint())) {
                    log.info("🔄 Refs changed in {}", state.workTree());
                    eventPublisher.publishEvent(new RepositoryMutationEvent(state.workTree(), "refs changed"));
                }
            } catch (IOException e) {
                log.warn("Could not read refs of {}: {}", gitDir, e.getMessage());
            }
        }
    }

    private static RepositoryState readState(Path gitDir) throws IOException {
        try (Repository repository = new FileRepositoryBuilder()
                .setGitDir(gitDir.toFile())
                .setMustExist(true)
                .build()) {
            StringBuilder fingerprint = new StringBuilder();

            Ref head = repository.exactRef(Constants.HEAD);
            if (head != null) {
                fingerprint.append(Constants.HEAD).append('=')
                        .append(head.isSymbolic() ? head.getTarget().getName() : "")
                        .append('@').append(objectName(head.getObjectId())).append('\n');
            }

            repository.getRefDatabase().getRefs().stream()
                    .sorted(Comparator.comparing(Ref::getName))
                    .forEach(ref -> fingerprint.append(ref.getName()).append('=')
                            .append(objectName(ref.getObjectId())).append('\n'));

            Path workTree = repository.isBare() ? gitDir : repository.getWorkTree().toPath();
            return new RepositoryState(workTree, fingerprint.toString());
        }
    }

    private static String objectName(ObjectId id) {
        return id == null ? "-" : id.name();
    }

    private record RepositoryState(Path workTree, String fingerprint) {
    }
}
