package com.pipeline.actions.quality;

import com.pipeline.core.exception.AnalysisServiceUnavailableException;
import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.Finding;
import com.pipeline.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Line-level checks over source files: long lines, leftover debug output,
 * TODO/FIXME markers and oversized files.
 */
public class RuleBasedAnalysisService implements AnalysisService {
    
    private static final Logger log = LoggerFactory.getLogger(RuleBasedAnalysisService.class);
    
    public static final String RULE_LONG_LINE = "long-line";
    public static final String RULE_DEBUG_OUTPUT = "debug-output";
    public static final String RULE_TODO = "todo-marker";
    public static final String RULE_LARGE_FILE = "large-file";
    
    private static final Set<String> EXTENSIONS = Set.of(
        "js", "jsx", "ts", "tsx", "java", "css", "scss", "html", "py"
    );
    private static final Set<String> SKIPPED_DIRECTORIES = Set.of(
        "node_modules", ".git", "build", "dist", "target", "coverage"
    );
    private static final Pattern DEBUG_OUTPUT = Pattern.compile(
        "\\bconsole\\.log\\(|\\bdebugger;|System\\.out\\.println\\(|\\bprint\\(");
    private static final Pattern TODO_MARKER = Pattern.compile("\\b(TODO|FIXME)\\b");
    
    private final int maxLineLength;
    private final int maxFileLines;
    
    public RuleBasedAnalysisService() {
        this(120, 500);
    }
    
    public RuleBasedAnalysisService(int maxLineLength, int maxFileLines) {
        this.maxLineLength = maxLineLength;
        this.maxFileLines = maxFileLines;
    }
    
    @Override
    public List<Finding> analyze(Path codeTree, AnalysisProject project) {
        Path sources = codeTree.resolve(project.sources() != null ? project.sources() : ".").normalize();
        if (!Files.isDirectory(sources)) {
            throw new ConfigurationException("sources", "source directory does not exist: " + project.sources());
        }
        
        List<Finding> findings = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(sources)) {
            List<Path> files = paths
                .filter(Files::isRegularFile)
                .filter(p -> !isSkipped(sources, p))
                .filter(RuleBasedAnalysisService::isSource)
                .sorted()
                .toList();
            for (Path file : files) {
                analyzeFile(codeTree.relativize(file).toString().replace('\\', '/'), file, findings);
            }
        } catch (IOException e) {
            throw new AnalysisServiceUnavailableException("Failed to read sources of " + project.projectKey(), e);
        }
        log.debug("Analyzed {} for project {}: {} findings", sources, project.projectKey(), findings.size());
        return findings;
    }
    
    // ========== Internal Methods ==========
    
    private void analyzeFile(String relative, Path file, List<Finding> findings) throws IOException {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            log.debug("Skipping non UTF-8 file {}", relative);
            return;
        }
        if (lines.size() > maxFileLines) {
            findings.add(new Finding(RULE_LARGE_FILE, Severity.MINOR, relative, 0,
                String.format("File has %d lines (max %d)", lines.size(), maxFileLines), false));
        }
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;
            if (line.length() > maxLineLength) {
                findings.add(new Finding(RULE_LONG_LINE, Severity.MINOR, relative, lineNumber,
                    String.format("Line exceeds %d characters", maxLineLength), false));
            }
            if (DEBUG_OUTPUT.matcher(line).find()) {
                findings.add(new Finding(RULE_DEBUG_OUTPUT, Severity.MAJOR, relative, lineNumber,
                    "Leftover debug output: " + line.trim(), false));
            }
            if (TODO_MARKER.matcher(line).find()) {
                findings.add(new Finding(RULE_TODO, Severity.INFO, relative, lineNumber,
                    "Unresolved marker: " + line.trim(), false));
            }
        }
    }
    
    private static boolean isSkipped(Path root, Path file) {
        for (Path part : root.relativize(file)) {
            if (SKIPPED_DIRECTORIES.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }
    
    private static boolean isSource(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
