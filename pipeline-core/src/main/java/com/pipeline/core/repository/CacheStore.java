package com.pipeline.core.repository;

import com.pipeline.core.model.Blob;
import com.pipeline.core.model.CacheEntry;
import java.util.Optional;

/**
 * Content-addressed store of dependency caches, shared across runs.
 * Safe for concurrent readers and writers.
 */
public interface CacheStore {

    /**
     * Exact-match lookup. A miss is an ordinary result, not an error.
     * 
     * @param key The derived cache key
     * @return The stored entry if present
     */
    Optional<CacheEntry> lookup(String key);

    /**
     * Store a blob under a key. If the key already exists the existing entry
     * is kept and returned; entries are never overwritten.
     * 
     * @param key The derived cache key
     * @param scope The branch scope the entry was produced on
     * @param blob The content to store
     * @return The entry now stored under the key
     */
    CacheEntry store(String key, String scope, Blob blob);

    /**
     * Total bytes currently held.
     */
    long totalSizeBytes();

    int entryCount();
}
