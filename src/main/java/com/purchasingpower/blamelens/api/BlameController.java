package com.purchasingpower.blamelens.api;

import com.purchasingpower.blamelens.configuration.AppProperties;
import com.purchasingpower.blamelens.event.RepositoryMutationEvent;
import com.purchasingpower.blamelens.model.vcs.ChangeRequest;
import com.purchasingpower.blamelens.model.vcs.LineResolution;
import com.purchasingpower.blamelens.service.cache.ResolutionCache;
import com.purchasingpower.blamelens.service.credential.CredentialStore;
import com.purchasingpower.blamelens.service.resolution.CancellationToken;
import com.purchasingpower.blamelens.service.resolution.ResolutionEngine;
import com.purchasingpower.blamelens.service.vcs.ProviderRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * REST surface of the resolution engine.
 *
 * Endpoints:
 * - GET /api/v1/blame/resolve?file=&line= - Attribution and change request of a line
 * - GET /api/v1/blame/stats?file=&line= - Change request of a line with size statistics
 * - POST /api/v1/repository/mutations - Signal a checkout/fetch/pull/commit
 * - DELETE /api/v1/cache - Clear the resolution cache
 * - PUT /api/v1/cache/ttl - Change the cache TTL
 * - PUT|DELETE /api/v1/credentials/{providerId} - Set or remove a provider token
 * - GET /api/v1/status - Providers and cache state
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class BlameController {

    private final ResolutionEngine resolutionEngine;
    private final ResolutionCache resolutionCache;
    private final ProviderRegistry providerRegistry;
    private final CredentialStore credentialStore;
    private final ApplicationEventPublisher eventPublisher;
    private final AppProperties props;

    /**
     * Waits up to {@code app.api.resolve-timeout-ms}. A lookup still running after that keeps
     * going in the background and its result is cached, so the caller gets {@code loading} and
     * can ask again.
     */
    @GetMapping("/blame/resolve")
    public ResponseEntity<ResolutionResponse> resolve(@RequestParam String file, @RequestParam int line) {
        Path path = toPath(file);
        requireValidLine(line);

        CompletableFuture<LineResolution> pending = resolutionEngine.resolve(path, line, CancellationToken.none());
        try {
            LineResolution resolution = pending.get(props.getApi().getResolveTimeoutMs(), TimeUnit.MILLISECONDS);
            return ResponseEntity.ok(ResolutionResponse.of(file, line, resolution));
        } catch (TimeoutException e) {
            log.debug("Resolution of {}:{} still running, answering loading", file, line);
            return ResponseEntity.ok(ResolutionResponse.loading(file, line));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ResolutionResponse.error("Interrupted"));
        } catch (ExecutionException e) {
            log.error("Resolution of {}:{} failed", file, line, e.getCause());
            return ResponseEntity.internalServerError()
                    .body(ResolutionResponse.error("Resolution failed: " + e.getCause().getMessage()));
        }
    }

    @GetMapping("/blame/stats")
    public ResponseEntity<ChangeRequest> stats(@RequestParam String file, @RequestParam int line) {
        Path path = toPath(file);
        requireValidLine(line);

        try {
            Optional<ChangeRequest> changeRequest = resolutionEngine.loadStats(path, line)
                    .get(props.getApi().getResolveTimeoutMs(), TimeUnit.MILLISECONDS);
            return changeRequest.map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (TimeoutException e) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        } catch (ExecutionException e) {
            log.error("Loading stats for {}:{} failed", file, line, e.getCause());
            return ResponseEntity.internalServerError().build();
        }
    }

    @PostMapping("/repository/mutations")
    public ResponseEntity<Void> repositoryMutated(@RequestBody(required = false) MutationRequest request) {
        Path repository = null;
        String reason = "external signal";
        if (request != null) {
            if (request.getRepository() != null && !request.getRepository().isBlank()) {
                repository = toPath(request.getRepository());
            }
            if (request.getReason() != null && !request.getReason().isBlank()) {
                reason = request.getReason();
            }
        }
        eventPublisher.publishEvent(new RepositoryMutationEvent(repository, reason));
        return ResponseEntity.accepted().build();
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        resolutionCache.clear();
        log.info("Resolution cache cleared on request");
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/cache/ttl")
    public ResponseEntity<Void> updateCacheTtl(@Valid @RequestBody CacheTtlRequest request) {
        resolutionCache.setTtl(Duration.ofSeconds(request.getTtlSeconds()));
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/credentials/{providerId}")
    public ResponseEntity<Void> setCredential(@PathVariable String providerId,
                                              @Valid @RequestBody CredentialRequest request) {
        if (providerRegistry.getProvider(providerId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        credentialStore.setToken(providerId, request.getToken());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/credentials/{providerId}")
    public ResponseEntity<Void> deleteCredential(@PathVariable String providerId) {
        if (providerRegistry.getProvider(providerId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        credentialStore.deleteToken(providerId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/status")
    public ResponseEntity<StatusResponse> status() {
        List<StatusResponse.ProviderStatus> providers = providerRegistry.getAllProviders().stream()
                .map(provider -> StatusResponse.ProviderStatus.builder()
                        .id(provider.getId())
                        .name(provider.getDisplayName())
                        .hostUrl(provider.getHostUrl())
                        .hasCredential(provider.hasCredential())
                        .build())
                .collect(Collectors.toList());

        return ResponseEntity.ok(StatusResponse.builder()
                .providers(providers)
                .cacheSize(resolutionCache.size())
                .cacheTtlSeconds(resolutionCache.getTtl().getSeconds())
                .inFlight(resolutionEngine.inFlightCount())
                .build());
    }

    private static Path toPath(String file) {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("File path is required");
        }
        try {
            return Path.of(file);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid file path: " + file);
        }
    }

    private static void requireValidLine(int line) {
        if (line < 1) {
            throw new IllegalArgumentException("Line numbers start at 1");
        }
    }
}
