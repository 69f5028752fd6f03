package com.pipeline.actions.cache;

import com.pipeline.actions.ActionContext;
import com.pipeline.actions.ActionException;
import com.pipeline.actions.ActionOutcome;
import com.pipeline.actions.CompositeAction;
import com.pipeline.core.model.Blob;
import com.pipeline.core.model.CacheEntry;
import com.pipeline.core.model.InputSpec;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.repository.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * {@code cache-save}: snapshots a workspace directory and stores it under the key
 * computed by an earlier {@code cache-restore}. Storing under an existing key keeps
 * the stored entry.
 */
public class CacheSaveAction implements CompositeAction {
    
    public static final String NAME = "cache-save";
    
    private static final Logger log = LoggerFactory.getLogger(CacheSaveAction.class);
    
    private static final List<InputSpec> INPUTS = List.of(
        InputSpec.required("path", "Workspace directory to cache"),
        InputSpec.required("key", "Cache key, usually the cache-key output of cache-restore")
    );
    
    private final CacheStore cacheStore;
    
    public CacheSaveAction(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public List<InputSpec> inputs() {
        return INPUTS;
    }
    
    @Override
    public ActionOutcome execute(ActionContext context) throws ActionException {
        String key = context.requireInput("key");
        String path = context.requireInput("path");
        int separator = key.indexOf(':');
        if (separator <= 0) {
            throw new ActionException("INVALID_CACHE_KEY", "Cache key must have the form scope:os:hash, got " + key);
        }
        
        Blob blob = Blob.snapshot(context.resolve(path));
        if (blob.isEmpty()) {
            context.log("Nothing to cache at " + path);
            return ActionOutcome.of(Map.of("saved", "false"));
        }
        
        CacheEntry entry = cacheStore.store(key, key.substring(0, separator), blob);
        boolean stored = entry.blob().contentHash().equals(blob.contentHash());
        log.info("Cache saved under {} ({} files, {} bytes)", key, blob.fileCount(), blob.sizeBytes());
        context.log("Cache saved with key: " + key);
        context.record(RunEventType.CACHE_STORED, Map.of("key", key, "sizeBytes", blob.sizeBytes()));
        return ActionOutcome.of(Map.of("saved", String.valueOf(stored))).withCacheKey(key);
    }
}
