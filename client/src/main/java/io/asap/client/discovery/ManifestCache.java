package io.asap.client.discovery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import io.asap.spec.Manifest;
import io.asap.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TTL and LRU cache of discovered manifests, keyed by discovery URL.
 * <p>
 * Expiry is checked lazily: an expired entry is removed by the {@link #get} that finds it, or by
 * {@link #cleanupExpired()}. The least recently used entry is evicted only when a new key is
 * inserted into a full cache. All operations are thread safe.
 */
public class ManifestCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManifestCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);
    public static final int DEFAULT_MAX_SIZE = 1000;

    private static final ManifestCache DEFAULT = new ManifestCache();

    // access order: iteration starts at the least recently used entry
    private final LinkedHashMap<String, ManifestCacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final ReentrantLock lock = new ReentrantLock();
    private final Duration defaultTtl;
    private final int maxSize;
    private final Clock clock;

    public ManifestCache() {
        this(DEFAULT_TTL, DEFAULT_MAX_SIZE, Clock.systemUTC());
    }

    public ManifestCache(Duration defaultTtl, int maxSize) {
        this(defaultTtl, maxSize, Clock.systemUTC());
    }

    public ManifestCache(Duration defaultTtl, int maxSize, Clock clock) {
        this.defaultTtl = Assert.checkNotNullParam("defaultTtl", defaultTtl);
        this.maxSize = Assert.checkMinimumParam("maxSize", 1, maxSize);
        this.clock = Assert.checkNotNullParam("clock", clock);
    }

    /**
     * @return the process-wide cache used by clients that are not given one
     */
    public static ManifestCache defaultCache() {
        return DEFAULT;
    }

    /**
     * @param url the discovery URL
     * @return the cached manifest, or {@code null} if absent or expired
     */
    public @Nullable Manifest get(String url) {
        ManifestCacheEntry entry = getEntry(url);
        return entry == null ? null : entry.manifest();
    }

    public @Nullable ManifestCacheEntry getEntry(String url) {
        lock.lock();
        try {
            ManifestCacheEntry entry = entries.get(url);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(url);
                LOGGER.debug("Manifest cache entry for {} expired", url);
                return null;
            }
            return entry;
        } finally {
            lock.unlock();
        }
    }

    public void set(String url, Manifest manifest) {
        set(url, manifest, null, null);
    }

    public void set(String url, Manifest manifest, @Nullable Duration ttl) {
        set(url, manifest, ttl, null);
    }

    /**
     * Caches a manifest, replacing any existing entry for the URL.
     *
     * @param url the discovery URL
     * @param manifest the manifest
     * @param ttl time to live, the cache default if {@code null}
     * @param etag the {@code ETag} of the response, if any
     */
    public void set(String url, Manifest manifest, @Nullable Duration ttl, @Nullable String etag) {
        Assert.checkNotNullParam("url", url);
        Assert.checkNotNullParam("manifest", manifest);
        Instant expiresAt = clock.instant().plus(ttl == null ? defaultTtl : ttl);
        lock.lock();
        try {
            if (!entries.containsKey(url) && entries.size() >= maxSize) {
                Iterator<String> eldest = entries.keySet().iterator();
                String evicted = eldest.next();
                eldest.remove();
                LOGGER.debug("Manifest cache full ({} entries), evicted {}", maxSize, evicted);
            }
            entries.put(url, new ManifestCacheEntry(manifest, expiresAt, etag));
        } finally {
            lock.unlock();
        }
    }

    public void invalidate(String url) {
        lock.lock();
        try {
            entries.remove(url);
        } finally {
            lock.unlock();
        }
    }

    public void clearAll() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the number of entries, including expired ones not yet removed
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired entry. Walks the whole cache; meant for periodic maintenance.
     *
     * @return the number of entries removed
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        lock.lock();
        try {
            int removed = 0;
            Iterator<Map.Entry<String, ManifestCacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                LOGGER.debug("Removed {} expired manifest cache entries", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public int getMaxSize() {
        return maxSize;
    }
}
