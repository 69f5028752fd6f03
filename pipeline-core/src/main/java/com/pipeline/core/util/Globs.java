package com.pipeline.core.util;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Path-glob matching for branch filters, ignored paths and cache key files.
 * {@code *} does not cross a {@code /}; {@code **} does.
 */
public final class Globs {

    static final int MAX_CACHED_MATCHERS = 512;

    // LRU, keyed by workflow-supplied patterns
    private static final Map<String, PathMatcher> MATCHERS = Collections.synchronizedMap(
        new LinkedHashMap<String, PathMatcher>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PathMatcher> eldest) {
                return size() > MAX_CACHED_MATCHERS;
            }
        });

    private Globs() {
    }

    /**
     * Check whether a slash-separated path matches a glob.
     */
    public static boolean matches(String glob, String path) {
        if (glob == null || path == null) {
            return false;
        }
        String normalized = normalize(path);
        if (normalized.isEmpty()) {
            return false;
        }
        // a leading "**/" also covers files at the root
        if (glob.startsWith("**/") && matcher(glob.substring(3)).matches(Path.of(normalized))) {
            return true;
        }
        return matcher(glob).matches(Path.of(normalized));
    }

    public static boolean matchesAny(Collection<String> globs, String path) {
        for (String glob : globs) {
            if (matches(glob, path)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check whether every path matches at least one glob. False for an empty path list.
     */
    public static boolean allMatchAny(Collection<String> globs, List<String> paths) {
        if (paths.isEmpty() || globs.isEmpty()) {
            return false;
        }
        return paths.stream().allMatch(p -> matchesAny(globs, p));
    }

    /**
     * Compile a glob without matching anything.
     *
     * @throws PatternSyntaxException if the glob is malformed
     */
    public static void checkSyntax(String glob) {
        if (glob == null || glob.isBlank()) {
            throw new PatternSyntaxException("empty pattern", String.valueOf(glob), -1);
        }
        if (glob.startsWith("**/")) {
            matcher(glob.substring(3));
        }
        matcher(glob);
    }

    static int cachedMatcherCount() {
        return MATCHERS.size();
    }

    private static PathMatcher matcher(String glob) {
        return MATCHERS.computeIfAbsent(glob,
            g -> FileSystems.getDefault().getPathMatcher("glob:" + g));
    }

    private static String normalize(String path) {
        String p = path.replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        return p;
    }
}
