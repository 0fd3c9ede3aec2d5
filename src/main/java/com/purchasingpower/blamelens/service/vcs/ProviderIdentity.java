package com.purchasingpower.blamelens.service.vcs;

/**
 * Who a provider is, as shown to the notification sink and on the status endpoint.
 */
public interface ProviderIdentity {

    /** Stable identifier, also the first half of cache keys (e.g. "gitlab"). */
    String getId();

    String getDisplayName();

    boolean hasCredential();
}
