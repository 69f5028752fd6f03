package com.pipeline.core.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.*;

class GlobsTest {

    @Test
    void singleStar_shouldNotCrossDirectories() {
        assertTrue(Globs.matches("feature/*", "feature/login"));
        assertFalse(Globs.matches("feature/*", "feature/login/form"));
    }

    @Test
    void doubleStar_shouldCrossDirectories() {
        assertTrue(Globs.matches("docs/**", "docs/guide/intro.md"));
        assertTrue(Globs.matches("**.md", "docs/guide/intro.md"));
        assertTrue(Globs.matches("**/*.md", "README.md"));
        assertFalse(Globs.matches("docs/**", "src/App.js"));
    }

    @Test
    void allMatchAny_shouldBeFalseForEmptyPaths() {
        assertFalse(Globs.allMatchAny(List.of("**.md"), List.of()));
        assertTrue(Globs.allMatchAny(List.of("**.md", "docs/**"), List.of("README.md", "docs/a.txt")));
        assertFalse(Globs.allMatchAny(List.of("**.md"), List.of("README.md", "src/App.js")));
    }

    @Test
    void checkSyntax_shouldRejectMalformedGlobs() {
        assertThrows(PatternSyntaxException.class, () -> Globs.checkSyntax("release/["));
        assertThrows(PatternSyntaxException.class, () -> Globs.checkSyntax("**/{a,b"));
        assertThrows(PatternSyntaxException.class, () -> Globs.checkSyntax(" "));
        assertDoesNotThrow(() -> Globs.checkSyntax("release/[0-9]*"));
    }

    @Test
    void matches_manyDistinctGlobs_shouldKeepCacheBounded() {
        for (int i = 0; i < Globs.MAX_CACHED_MATCHERS * 2; i++) {
            Globs.matches("build-" + i + "/**", "build-" + i + "/out.js");
        }

        assertTrue(Globs.cachedMatcherCount() <= Globs.MAX_CACHED_MATCHERS);
    }
}
