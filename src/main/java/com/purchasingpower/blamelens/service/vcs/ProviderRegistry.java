package com.purchasingpower.blamelens.service.vcs;

import com.purchasingpower.blamelens.event.CredentialChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered {@link ProviderClient}s in registration order.
 *
 * <p>Detection walks the providers in that order and returns the first whose
 * {@link ProviderClient#isProviderUrl(String)} accepts the remote. Spring injects the clients
 * ordered by their {@code @Order}, GitLab first.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final Map<String, ProviderClient> providers = new LinkedHashMap<>();

    public ProviderRegistry(List<ProviderClient> clients) {
        clients.forEach(this::register);
        log.info("Registered {} providers: {}", providers.size(), providers.keySet());
    }

    /**
     * Adds a provider; a provider with the same id is replaced in place.
     */
    public synchronized void register(ProviderClient provider) {
        providers.put(provider.getId(), provider);
    }

    public synchronized Optional<ProviderClient> getProvider(String id) {
        return Optional.ofNullable(providers.get(id));
    }

    public synchronized Optional<ProviderClient> detectProvider(String remoteUrl) {
        if (remoteUrl == null || remoteUrl.isBlank()) {
            return Optional.empty();
        }
        for (ProviderClient provider : providers.values()) {
            if (provider.isProviderUrl(remoteUrl)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }

    public synchronized List<ProviderClient> getAllProviders() {
        return Collections.unmodifiableList(new ArrayList<>(providers.values()));
    }

    public synchronized void clear() {
        providers.clear();
    }

    @EventListener
    public void onCredentialChanged(CredentialChangedEvent event) {
        getProvider(event.providerId()).ifPresentOrElse(
                provider -> {
                    provider.resetNotificationState();
                    log.debug("Notification state reset for provider '{}'", provider.getId());
                },
                () -> log.warn("Credential changed for unknown provider '{}'", event.providerId()));
    }
}
