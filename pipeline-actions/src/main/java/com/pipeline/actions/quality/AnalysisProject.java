package com.pipeline.actions.quality;

import com.pipeline.core.exception.ConfigurationException;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Identifiers of the analyzed project, as named in {@code analysis-project.properties}:
 * {@code projectKey}, {@code organization} and {@code sources}.
 */
public record AnalysisProject(String projectKey, String organization, String sources) {
    
    public static final String DEFAULT_FILE = "analysis-project.properties";
    
    /**
     * Read project identifiers from a properties file. Missing file yields all nulls.
     */
    public static AnalysisProject load(Path file) {
        if (!Files.isRegularFile(file)) {
            return new AnalysisProject(null, null, null);
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        return new AnalysisProject(
            properties.getProperty("projectKey"),
            properties.getProperty("organization"),
            properties.getProperty("sources")
        );
    }
    
    /**
     * Values of this project override those of the fallback where set.
     * 
     * @throws ConfigurationException if no project key is known after merging
     */
    public AnalysisProject orElse(AnalysisProject fallback, String location) {
        AnalysisProject merged = new AnalysisProject(
            firstNonBlank(projectKey, fallback.projectKey),
            firstNonBlank(organization, fallback.organization),
            firstNonBlank(sources, firstNonBlank(fallback.sources, "."))
        );
        if (merged.projectKey == null) {
            throw new ConfigurationException(location,
                "no project key: set the 'project-key' input or 'projectKey' in " + DEFAULT_FILE);
        }
        return merged;
    }
    
    private static String firstNonBlank(String a, String b) {
        return a != null && !a.isBlank() ? a.trim() : b;
    }
}
