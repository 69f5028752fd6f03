package com.pipeline.engine.persistence;

import com.pipeline.core.model.Blob;
import com.pipeline.core.model.CacheEntry;
import com.pipeline.core.repository.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory cache store with least-recently-used eviction beyond a byte budget.
 * Lookups refresh recency. Entries are never overwritten.
 */
public class InMemoryCacheStore implements CacheStore {
    
    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);
    
    private final long maxSizeBytes;
    
    // Access-ordered: iteration starts at the least recently used entry
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long totalSizeBytes;
    private long evictions;
    
    public InMemoryCacheStore(long maxSizeBytes) {
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException("Cache size budget must be positive: " + maxSizeBytes);
        }
        this.maxSizeBytes = maxSizeBytes;
    }
    
    @Override
    public synchronized Optional<CacheEntry> lookup(String key) {
        return Optional.ofNullable(entries.get(key));
    }
    
    @Override
    public synchronized CacheEntry store(String key, String scope, Blob blob) {
        CacheEntry existing = entries.get(key);
        if (existing != null) {
            log.debug("Cache key {} already stored, keeping existing entry", key);
            return existing;
        }
        CacheEntry entry = new CacheEntry(key, scope, blob, Instant.now());
        if (blob.sizeBytes() > maxSizeBytes) {
            log.warn("Cache entry {} ({} bytes) exceeds the cache budget of {} bytes, not stored",
                key, blob.sizeBytes(), maxSizeBytes);
            return entry;
        }
        entries.put(key, entry);
        totalSizeBytes += blob.sizeBytes();
        evictIfNeeded(key);
        return entry;
    }
    
    @Override
    public synchronized long totalSizeBytes() {
        return totalSizeBytes;
    }
    
    @Override
    public synchronized int entryCount() {
        return entries.size();
    }
    
    public long getMaxSizeBytes() {
        return maxSizeBytes;
    }
    
    public synchronized long getEvictions() {
        return evictions;
    }
    
    private void evictIfNeeded(String protectedKey) {
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        while (totalSizeBytes > maxSizeBytes && it.hasNext()) {
            Map.Entry<String, CacheEntry> eldest = it.next();
            if (eldest.getKey().equals(protectedKey)) {
                continue;
            }
            it.remove();
            totalSizeBytes -= eldest.getValue().sizeBytes();
            evictions++;
            log.info("Evicted cache entry {} ({} bytes)", eldest.getKey(), eldest.getValue().sizeBytes());
        }
    }
}
