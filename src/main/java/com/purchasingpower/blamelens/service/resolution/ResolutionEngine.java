package com.purchasingpower.blamelens.service.resolution;

import com.purchasingpower.blamelens.configuration.AsyncConfig;
import com.purchasingpower.blamelens.model.blame.LineAttribution;
import com.purchasingpower.blamelens.model.vcs.ChangeRequest;
import com.purchasingpower.blamelens.model.vcs.LineResolution;
import com.purchasingpower.blamelens.model.vcs.RemoteIdentity;
import com.purchasingpower.blamelens.model.vcs.ResolutionOutcome;
import com.purchasingpower.blamelens.service.cache.ResolutionCache;
import com.purchasingpower.blamelens.service.git.BlameService;
import com.purchasingpower.blamelens.service.git.RemoteUrlLocator;
import com.purchasingpower.blamelens.service.vcs.ProviderClient;
import com.purchasingpower.blamelens.service.vcs.ProviderRegistry;
import com.purchasingpower.blamelens.service.vcs.ProviderResult;
import com.purchasingpower.blamelens.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Resolves a blamed line to the change request that landed its commit.
 *
 * <p>Flow: remote URL, provider detection, cache, in-flight check, credential, remote parsing,
 * coalesced provider query. Configuration problems (no remote, unknown host, no token) answer
 * {@code unchecked} without touching the cache. Provider failures are cached as "no change
 * request" and forwarded to the {@link NotificationSink}.
 *
 * <p>Cache lookup and the in-flight check run under one lock, and the coalescer completes its
 * future before dropping the key, so a finished query is always visible either as a cache
 * entry or as in-flight.
 */
@Slf4j
@Service
public class ResolutionEngine {

    private final ProviderRegistry providerRegistry;
    private final ResolutionCache cache;
    private final RemoteUrlLocator remoteUrlLocator;
    private final NotificationSink notificationSink;
    private final BlameService blameService;
    private final Executor blameExecutor;

    private final RequestCoalescer<ProviderResult<ChangeRequest>> coalescer = new RequestCoalescer<>();
    private final Object lookupLock = new Object();

    public ResolutionEngine(ProviderRegistry providerRegistry,
                            ResolutionCache cache,
                            RemoteUrlLocator remoteUrlLocator,
                            NotificationSink notificationSink,
                            BlameService blameService,
                            @Qualifier(AsyncConfig.BLAME_EXECUTOR) Executor blameExecutor) {
        this.providerRegistry = providerRegistry;
        this.cache = cache;
        this.remoteUrlLocator = remoteUrlLocator;
        this.notificationSink = notificationSink;
        this.blameService = blameService;
        this.blameExecutor = blameExecutor;
    }

    /**
     * Blames {@code line} on the blame executor, then resolves the attribution.
     *
     * @param line 1-based line number
     */
    public CompletableFuture<LineResolution> resolve(Path file, int line, CancellationToken token) {
        return CompletableFuture
                .supplyAsync(() -> blameService.getAttributionForLine(file, line), blameExecutor)
                .thenCompose(attribution -> attribution
                        .map(found -> resolve(file, found, token)
                                .thenApply(outcome -> new LineResolution(found, outcome)))
                        .orElseGet(() -> CompletableFuture.completedFuture(
                                new LineResolution(null, ResolutionOutcome.unchecked()))));
    }

    public CompletableFuture<ResolutionOutcome> resolve(Path file, LineAttribution attribution, CancellationToken token) {
        if (attribution == null || attribution.getCommitId() == null || token.isCancellationRequested()) {
            return unchecked();
        }

        Optional<String> remoteUrl = remoteUrlLocator.findRemoteUrl(file);
        if (remoteUrl.isEmpty()) {
            log.debug("No remote for {}", file);
            return unchecked();
        }

        Optional<ProviderClient> detected = providerRegistry.detectProvider(remoteUrl.get());
        if (detected.isEmpty()) {
            log.debug("No provider recognises remote {}", remoteUrl.get());
            return unchecked();
        }

        ProviderClient provider = detected.get();
        String commitId = attribution.getCommitId();
        String key = ResolutionCache.key(provider.getId(), commitId);

        CompletableFuture<ResolutionOutcome> settled;
        synchronized (lookupLock) {
            Optional<ResolutionCache.CacheEntry> cached = cache.get(provider.getId(), commitId);
            if (cached.isPresent()) {
                return CompletableFuture.completedFuture(ResolutionOutcome.resolved(cached.get().getValue()));
            }
            if (coalescer.isInFlight(key)) {
                return CompletableFuture.completedFuture(ResolutionOutcome.loading());
            }
            if (!provider.hasCredential()) {
                log.debug("No credential for {}, skipping lookup of {}", provider.getDisplayName(),
                        ExternalCallLogger.shortSha(commitId));
                return unchecked();
            }
            Optional<RemoteIdentity> remote = provider.parseRemoteUrl(remoteUrl.get());
            if (remote.isEmpty()) {
                log.debug("Remote {} has no project path", remoteUrl.get());
                return unchecked();
            }

            RemoteIdentity identity = remote.get();
            settled = coalescer
                    .coalesce(key, () -> provider
                            .resolveChangeRequest(identity.getProjectPath(), commitId, identity.getHostUrl())
                            .toFuture())
                    .handle((result, error) -> settle(provider, commitId, result, error, token));
        }

        return raceWithCancellation(settled, token);
    }

    /**
     * Blames {@code line}, then loads stats for its cached change request.
     */
    public CompletableFuture<Optional<ChangeRequest>> loadStats(Path file, int line) {
        return CompletableFuture
                .supplyAsync(() -> blameService.getAttributionForLine(file, line), blameExecutor)
                .thenCompose(attribution -> attribution
                        .map(found -> loadStats(file, found))
                        .orElseGet(() -> CompletableFuture.completedFuture(Optional.empty())));
    }

    /**
     * Loads size statistics for the change request cached for {@code attribution}'s commit.
     * Stats are fetched at most once per cache entry; a failed fetch returns the change request
     * without stats.
     *
     * @return empty if nothing non-null is cached for the commit
     */
    public CompletableFuture<Optional<ChangeRequest>> loadStats(Path file, LineAttribution attribution) {
        if (attribution == null || attribution.getCommitId() == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        Optional<String> remoteUrl = remoteUrlLocator.findRemoteUrl(file);
        Optional<ProviderClient> detected = remoteUrl.flatMap(providerRegistry::detectProvider);
        if (detected.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }

        ProviderClient provider = detected.get();
        String commitId = attribution.getCommitId();
        Optional<ChangeRequest> cached = cache.get(provider.getId(), commitId)
                .map(ResolutionCache.CacheEntry::getValue);
        if (cached.isEmpty() || cached.get().getStats() != null || !provider.hasCredential()) {
            return CompletableFuture.completedFuture(cached);
        }

        Optional<RemoteIdentity> remote = provider.parseRemoteUrl(remoteUrl.get());
        if (remote.isEmpty()) {
            return CompletableFuture.completedFuture(cached);
        }

        ChangeRequest changeRequest = cached.get();
        return provider.fetchStats(remote.get().getProjectPath(), changeRequest.getNumber(), remote.get().getHostUrl())
                .toFuture()
                .handle((result, error) -> {
                    if (error != null || result == null || !result.isSuccess() || result.getValue() == null) {
                        log.debug("Stats unavailable for change request {} of {}", changeRequest.getNumber(),
                                provider.getDisplayName());
                        return Optional.of(changeRequest);
                    }
                    cache.updateStats(provider.getId(), commitId, result.getValue());
                    return Optional.of(changeRequest.withStats(result.getValue()));
                });
    }

    public int inFlightCount() {
        return coalescer.inFlightCount();
    }

    /**
     * Runs in the triggering caller's continuation. A caller that cancelled first discards even a
     * successful answer, so nothing is cached and nothing is notified for it; the next hover on
     * that commit queries again. Caching from the shared completion path instead would keep the
     * answer but would write on behalf of a caller that asked for nothing to happen.
     */
    private ResolutionOutcome settle(ProviderClient provider, String commitId,
                                     ProviderResult<ChangeRequest> result, Throwable error,
                                     CancellationToken token) {
        if (token.isCancellationRequested()) {
            log.debug("Lookup of {} settled after cancellation, discarding", ExternalCallLogger.shortSha(commitId));
            return ResolutionOutcome.unchecked();
        }

        if (error != null) {
            // provider clients report failures as values, so this is a bug rather than an outage
            log.error("Lookup of {} on {} failed unexpectedly", ExternalCallLogger.shortSha(commitId),
                    provider.getDisplayName(), error);
            cache.set(provider.getId(), commitId, null);
            return ResolutionOutcome.unchecked();
        }

        if (result == null || result.isSuccess()) {
            ChangeRequest changeRequest = result == null ? null : result.getValue();
            cache.set(provider.getId(), commitId, changeRequest);
            return ResolutionOutcome.resolved(changeRequest);
        }

        cache.set(provider.getId(), commitId, null);
        notificationSink.onProviderFailure(result.getFailure(), provider);
        return ResolutionOutcome.unchecked();
    }

    private static CompletableFuture<ResolutionOutcome> raceWithCancellation(
            CompletableFuture<ResolutionOutcome> settled, CancellationToken token) {
        CompletableFuture<ResolutionOutcome> outcome = new CompletableFuture<>();
        token.onCancellationRequested(() -> outcome.complete(ResolutionOutcome.unchecked()));
        settled.whenComplete((value, error) -> outcome.complete(error == null ? value : ResolutionOutcome.unchecked()));
        return outcome;
    }

    private static CompletableFuture<ResolutionOutcome> unchecked() {
        return CompletableFuture.completedFuture(ResolutionOutcome.unchecked());
    }
}
