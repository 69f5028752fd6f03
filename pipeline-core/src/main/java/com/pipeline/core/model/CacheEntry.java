package com.pipeline.core.model;

import java.time.Instant;

/**
 * A stored dependency cache. Entries are immutable once stored;
 * only the access timestamp tracked by the store changes.
 */
public record CacheEntry(
    String key,
    String scope,
    Blob blob,
    Instant createdAt
) {
    public long sizeBytes() {
        return blob.sizeBytes();
    }
}
