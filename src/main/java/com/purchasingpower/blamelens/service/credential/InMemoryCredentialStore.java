package com.purchasingpower.blamelens.service.credential;

import com.purchasingpower.blamelens.configuration.AppProperties;
import com.purchasingpower.blamelens.event.CredentialChangedEvent;
import com.purchasingpower.blamelens.service.vcs.GitHubProviderClient;
import com.purchasingpower.blamelens.service.vcs.GitLabProviderClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps provider tokens in memory for the lifetime of the process.
 *
 * Tokens are seeded from {@code app.gitlab.token} / {@code app.github.token} at startup and can
 * be replaced at runtime through the credentials endpoint. Token values are never logged.
 */
@Slf4j
@Service
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, String> tokens = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher eventPublisher;

    @Autowired
    public InMemoryCredentialStore(AppProperties props, ApplicationEventPublisher eventPublisher) {
        this(eventPublisher);
        seed(GitLabProviderClient.ID, props.getGitlab().getToken());
        seed(GitHubProviderClient.ID, props.getGithub().getToken());
    }

    public InMemoryCredentialStore(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public Optional<String> getToken(String providerId) {
        return Optional.ofNullable(tokens.get(providerId));
    }

    @Override
    public boolean hasCredential(String providerId) {
        return getToken(providerId).filter(token -> !token.isEmpty()).isPresent();
    }

    @Override
    public void setToken(String providerId, String token) {
        if (token == null || token.isBlank()) {
            deleteToken(providerId);
            return;
        }
        tokens.put(providerId, token.trim());
        log.info("Token updated for provider '{}'", providerId);
        eventPublisher.publishEvent(new CredentialChangedEvent(providerId));
    }

    @Override
    public void deleteToken(String providerId) {
        tokens.remove(providerId);
        log.info("Token removed for provider '{}'", providerId);
        eventPublisher.publishEvent(new CredentialChangedEvent(providerId));
    }

    private void seed(String providerId, String token) {
        if (token != null && !token.isBlank()) {
            tokens.put(providerId, token.trim());
            log.info("Loaded configured token for provider '{}'", providerId);
        }
    }
}
