package com.pipeline.actions.cache;

import com.pipeline.actions.ActionContext;
import com.pipeline.actions.ActionOutcome;
import com.pipeline.actions.CompositeAction;
import com.pipeline.core.model.CacheEntry;
import com.pipeline.core.model.CacheKeys;
import com.pipeline.core.model.InputSpec;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.repository.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code cache-restore}: derives the cache key from the hash of the key files and
 * restores a matching entry into the workspace.
 * 
 * The branch's own scope is checked first, then the default branch's scope.
 * A miss is not a failure; the {@code cache-hit} output lets later steps run the
 * fallback install, and {@code cache-key} is the key a later {@code cache-save} stores under.
 */
public class CacheRestoreAction implements CompositeAction {
    
    public static final String NAME = "cache-restore";
    
    public static final String OUTPUT_HIT = "cache-hit";
    public static final String OUTPUT_KEY = "cache-key";
    public static final String OUTPUT_MATCHED_KEY = "cache-matched-key";
    
    private static final Logger log = LoggerFactory.getLogger(CacheRestoreAction.class);
    
    private static final List<InputSpec> INPUTS = List.of(
        InputSpec.required("path", "Workspace directory to restore into"),
        InputSpec.optional("key-files", "**/package-lock.json", "Comma-separated globs of files whose content keys the cache"),
        InputSpec.optional("prefix", "deps", "Cache name, prepended to the repository and branch scope")
    );
    
    private final CacheStore cacheStore;
    private final String defaultBranch;
    
    public CacheRestoreAction(CacheStore cacheStore, String defaultBranch) {
        this.cacheStore = cacheStore;
        this.defaultBranch = defaultBranch;
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
    public ActionOutcome execute(ActionContext context) {
        String prefix = context.getInput("prefix");
        String hash = CacheKeys.hashFiles(context.getWorkspace(), splitGlobs(context.getInput("key-files")));
        String repository = context.getRun().event().repository();
        String branch = context.getRun().branch();
        
        String primaryKey = CacheKeys.derive(scope(prefix, repository, branch), context.getOsIdentifier(), hash);
        List<String> candidates = new ArrayList<>();
        candidates.add(primaryKey);
        if (defaultBranch != null && !defaultBranch.equals(branch)) {
            candidates.add(CacheKeys.derive(scope(prefix, repository, defaultBranch), context.getOsIdentifier(), hash));
        }
        
        for (String key : candidates) {
            Optional<CacheEntry> entry = cacheStore.lookup(key);
            if (entry.isPresent()) {
                entry.get().blob().restoreTo(context.resolve(context.requireInput("path")));
                log.info("Cache hit for {} ({} bytes)", key, entry.get().sizeBytes());
                context.log("Cache restored from key: " + key);
                context.record(RunEventType.CACHE_HIT, payload(primaryKey, key));
                return ActionOutcome.of(Map.of(
                    OUTPUT_HIT, "true",
                    OUTPUT_KEY, primaryKey,
                    OUTPUT_MATCHED_KEY, key
                ));
            }
        }
        
        log.info("Cache miss for {}", primaryKey);
        context.log("Cache not found for key: " + primaryKey);
        context.record(RunEventType.CACHE_MISS, payload(primaryKey, null));
        return ActionOutcome.of(Map.of(
            OUTPUT_HIT, "false",
            OUTPUT_KEY, primaryKey,
            OUTPUT_MATCHED_KEY, ""
        ));
    }
    
    /**
     * Scope of a cache entry: the cache name plus the repository and branch it was produced on.
     * Entries never cross repositories.
     */
    public static String scope(String prefix, String repository, String branch) {
        return prefix + "@" + repository + "@" + branch;
    }
    
    static List<String> splitGlobs(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split("[,\\n]"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }
    
    private static Map<String, Object> payload(String key, String matchedKey) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("key", key);
        payload.put("matchedKey", matchedKey);
        return payload;
    }
}
