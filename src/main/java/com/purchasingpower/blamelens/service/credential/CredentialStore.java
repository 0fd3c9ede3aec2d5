package com.purchasingpower.blamelens.service.credential;

import java.util.Optional;

/**
 * Access tokens per provider id. Every mutation publishes a
 * {@link com.purchasingpower.blamelens.event.CredentialChangedEvent}.
 */
public interface CredentialStore {

    Optional<String> getToken(String providerId);

    boolean hasCredential(String providerId);

    void setToken(String providerId, String token);

    void deleteToken(String providerId);
}
