package com.purchasingpower.blamelens.configuration;

import lombok.Data;

/**
 * Polling of known repositories for ref changes (checkout, fetch, pull, commit).
 * Each detected change invalidates the resolution cache.
 */
@Data
public class RepositoryWatchProperties {

    private boolean enabled = true;

    private long intervalMs = 5_000;
}
