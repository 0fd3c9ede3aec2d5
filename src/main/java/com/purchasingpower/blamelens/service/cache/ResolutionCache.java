package com.purchasingpower.blamelens.service.cache;

import com.purchasingpower.blamelens.configuration.AppProperties;
import com.purchasingpower.blamelens.event.RepositoryMutationEvent;
import com.purchasingpower.blamelens.model.vcs.ChangeRequest;
import com.purchasingpower.blamelens.model.vcs.ChangeRequestStats;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Commit to change-request cache with a single TTL.
 *
 * <p>Entries are keyed by {@code providerId:commitId}. A cached {@code null} value means "this
 * commit has no change request" (or the provider failed) and counts as a hit. Expired entries
 * are evicted lazily on read. Any repository mutation wipes the whole cache, since a rebase or
 * force push can make previously resolved commits meaningless.
 */
@Slf4j
@Component
public class ResolutionCache {

    @Value
    public static class CacheEntry {
        ChangeRequest value;
        Instant expiresAt;
    }

    private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile Duration ttl;

    @Autowired
    public ResolutionCache(AppProperties props) {
        this(props.getCache().getTtl(), Clock.systemUTC());
    }

    public ResolutionCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public static String key(String providerId, String commitId) {
        return providerId + ":" + commitId;
    }

    public Optional<CacheEntry> get(String providerId, String commitId) {
        String key = key(providerId, commitId);
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.getExpiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public boolean has(String providerId, String commitId) {
        return get(providerId, commitId).isPresent();
    }

    /**
     * Stores a result. Does nothing while caching is disabled (TTL of zero or less).
     */
    public void set(String providerId, String commitId, ChangeRequest value) {
        Duration currentTtl = ttl;
        if (isDisabled(currentTtl)) {
            return;
        }
        entries.put(key(providerId, commitId), new CacheEntry(value, expiryFrom(clock.instant(), currentTtl)));
    }

    /**
     * Attaches stats to a live, non-null entry without extending its lifetime.
     *
     * @return false if there is no such entry
     */
    public boolean updateStats(String providerId, String commitId, ChangeRequestStats stats) {
        Optional<CacheEntry> current = get(providerId, commitId);
        if (current.isEmpty() || current.get().getValue() == null) {
            return false;
        }
        CacheEntry entry = current.get();
        CacheEntry updated = new CacheEntry(entry.getValue().withStats(stats), entry.getExpiresAt());
        return entries.replace(key(providerId, commitId), entry, updated);
    }

    public void clear() {
        int removed = entries.size();
        entries.clear();
        log.debug("Resolution cache cleared ({} entries)", removed);
    }

    /**
     * Number of stored entries, including expired ones not yet evicted.
     */
    public int size() {
        return entries.size();
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
        log.info("Resolution cache TTL set to {}s{}", ttl.getSeconds(), isDisabled(ttl) ? " (caching disabled)" : "");
    }

    @EventListener
    public void onRepositoryMutation(RepositoryMutationEvent event) {
        log.info("Repository {} changed ({}), clearing resolution cache", event.repository(), event.reason());
        clear();
    }

    /**
     * A TTL reaching past {@link Instant#MAX} saturates there, so the entry never expires.
     */
    static Instant expiryFrom(Instant now, Duration ttl) {
        if (ttl.compareTo(Duration.between(now, Instant.MAX)) >= 0) {
            return Instant.MAX;
        }
        return now.plus(ttl);
    }

    private static boolean isDisabled(Duration ttl) {
        return ttl == null || ttl.isZero() || ttl.isNegative();
    }
}
