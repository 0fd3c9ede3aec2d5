package com.purchasingpower.blamelens.event;

/**
 * Published when a provider's token is set, replaced or deleted.
 */
public record CredentialChangedEvent(String providerId) {
}
