package io.asap.client.discovery;

import java.time.Instant;

import io.asap.spec.Manifest;
import org.jspecify.annotations.Nullable;

/**
 * A cached manifest and the instant it stops being valid.
 *
 * @param manifest the manifest
 * @param expiresAt expiry instant; the entry is expired from this instant on
 * @param etag the {@code ETag} the manifest was served with, if any
 */
public record ManifestCacheEntry(Manifest manifest, Instant expiresAt, @Nullable String etag) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
