package com.purchasingpower.blamelens.service.vcs;

import com.purchasingpower.blamelens.model.CallContext;
import com.purchasingpower.blamelens.model.vcs.RemoteIdentity;
import com.purchasingpower.blamelens.service.credential.CredentialStore;
import com.purchasingpower.blamelens.util.RemoteUrlParser;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Behaviour shared by the hosting provider clients: credential lookup, remote URL matching,
 * HTTP status mapping and the "report credential problems once" flag.
 */
public abstract class AbstractProviderClient implements ProviderClient {

    private final WebClient webClient;
    private final CredentialStore credentialStore;
    private final String hostUrl;
    private final Duration requestTimeout;

    private final AtomicBoolean credentialFailureReported = new AtomicBoolean(false);

    protected AbstractProviderClient(WebClient webClient, CredentialStore credentialStore,
                                     String hostUrl, Duration requestTimeout) {
        this.webClient = webClient;
        this.credentialStore = credentialStore;
        this.hostUrl = stripTrailingSlash(hostUrl);
        this.requestTimeout = requestTimeout;
    }

    /**
     * Lower-case token that appears in this provider's hostnames ("gitlab", "github").
     */
    protected abstract String brandToken();

    protected abstract void applyAuthentication(HttpHeaders headers, String token);

    @Override
    public String getHostUrl() {
        return hostUrl;
    }

    @Override
    public boolean hasCredential() {
        return credentialStore.hasCredential(getId());
    }

    /**
     * Matches when the remote's hostname contains the brand token, or when it equals the host of
     * the configured base URL. The second rule covers self-hosted instances named e.g.
     * {@code code.example.com}.
     */
    @Override
    public boolean isProviderUrl(String remoteUrl) {
        Optional<String> hostname = RemoteUrlParser.extractHostname(remoteUrl);
        if (hostname.isEmpty()) {
            return false;
        }
        String host = hostname.get().toLowerCase(Locale.ROOT);
        if (host.contains(brandToken())) {
            return true;
        }
        return RemoteUrlParser.configuredGitHost(hostUrl)
                .map(configured -> configured.equalsIgnoreCase(host))
                .orElse(false);
    }

    @Override
    public Optional<RemoteIdentity> parseRemoteUrl(String remoteUrl) {
        if (!isProviderUrl(remoteUrl)) {
            return Optional.empty();
        }
        return RemoteUrlParser.parse(remoteUrl);
    }

    @Override
    public void resetNotificationState() {
        credentialFailureReported.set(false);
    }

    protected Optional<String> currentToken() {
        return credentialStore.getToken(getId()).filter(token -> !token.isEmpty());
    }

    protected String resolveHost(String hostOverride) {
        if (hostOverride == null || hostOverride.isBlank()) {
            return hostUrl;
        }
        return stripTrailingSlash(hostOverride.trim());
    }

    /**
     * GET a JSON resource. 2xx bodies are decoded (an empty body yields success with null);
     * anything else becomes a {@link ProviderFailure}. The returned Mono never errors.
     */
    protected <T> Mono<ProviderResult<T>> getJson(URI uri, String token, ParameterizedTypeReference<T> type) {
        Mono<ProviderResult<T>> exchange = webClient.get()
                .uri(uri)
                .headers(headers -> applyAuthentication(headers, token))
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(type)
                                .map(ProviderResult::<T>success)
                                .defaultIfEmpty(ProviderResult.success(null));
                    }
                    int status = response.statusCode().value();
                    return response.releaseBody()
                            .then(Mono.fromSupplier(() -> ProviderResult.<T>failure(failureForStatus(status))));
                });

        return exchange
                .timeout(requestTimeout)
                .onErrorResume(error -> Mono.just(ProviderResult.failure(failureForException(error))));
    }

    protected <T> Mono<ProviderResult<T>> getJson(URI uri, String token, Class<T> type) {
        return getJson(uri, token, ParameterizedTypeReference.forType(type));
    }

    protected ProviderFailure noCredential() {
        return ProviderFailure.builder()
                .kind(FailureKind.NO_CREDENTIAL)
                .message("No access token configured for " + getDisplayName())
                .shouldNotifyUser(claimNotification())
                .build();
    }

    protected ProviderFailure failureForStatus(int statusCode) {
        return switch (statusCode) {
            case 401, 403 -> ProviderFailure.builder()
                    .kind(FailureKind.INVALID_CREDENTIAL)
                    .message("Invalid or expired token")
                    .statusCode(statusCode)
                    .shouldNotifyUser(claimNotification())
                    .build();
            case 404 -> silentFailure(FailureKind.NOT_FOUND, "Project or commit not found", statusCode);
            case 429 -> silentFailure(FailureKind.RATE_LIMITED, "API rate limited", statusCode);
            default -> silentFailure(FailureKind.UNKNOWN, "API error " + statusCode, statusCode);
        };
    }

    protected ProviderFailure failureForException(Throwable error) {
        if (isTransportFailure(error)) {
            String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            return silentFailure(FailureKind.NETWORK_ERROR, message, null);
        }
        return silentFailure(FailureKind.UNKNOWN, "Unexpected response: " + error.getMessage(), null);
    }

    protected static <T> void logResult(CallContext call, ProviderResult<T> result) {
        if (result.isSuccess()) {
            call.logResponse(result.getValue() != null ? "Found" : "None");
        } else {
            ProviderFailure failure = result.getFailure();
            call.logError(failure.getKind() + ": " + failure.getMessage(), null);
        }
    }

    /**
     * Percent-encodes a value for use inside a single path segment; slashes become %2F.
     */
    protected static String encode(String value) {
        return UriUtils.encode(value, StandardCharsets.UTF_8);
    }

    protected static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeException e) {
            return null;
        }
    }

    private boolean claimNotification() {
        return credentialFailureReported.compareAndSet(false, true);
    }

    private static ProviderFailure silentFailure(FailureKind kind, String message, Integer statusCode) {
        return ProviderFailure.builder()
                .kind(kind)
                .message(message)
                .statusCode(statusCode)
                .shouldNotifyUser(false)
                .build();
    }

    private static boolean isTransportFailure(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            // Jackson's parse errors are IOExceptions; a body that cannot be decoded is not a transport problem
            if (current instanceof CodecException) {
                return false;
            }
            if (current instanceof WebClientRequestException
                    || current instanceof IOException
                    || current instanceof TimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
