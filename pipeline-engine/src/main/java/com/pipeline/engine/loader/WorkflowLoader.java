package com.pipeline.engine.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.EventKind;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.TriggerSpec;
import com.pipeline.core.model.WorkflowDefinition;
import com.pipeline.engine.graph.WorkflowValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads workflow definitions from YAML.
 *
 * <pre>
 * name: deploy-pages
 * on:
 *   push:
 *     branches: [main]
 *     paths-ignore: ['docs/**']
 *   workflow_dispatch: {}
 * permissions:
 *   pages: write
 * jobs:
 *   build:
 *     runs-on: ubuntu-latest
 *     steps:
 *       - run: npm ci
 *   deploy:
 *     needs: build
 *     environment: production
 *     steps:
 *       - uses: deploy
 *         with:
 *           artifact: site
 * </pre>
 *
 * {@code on} may also be a single event name or a list of names. A top-level
 * {@code skip-marker} replaces the default {@code [skip ci]}.
 */
public class WorkflowLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowLoader.class);

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    /**
     * Load every {@code .yml}/{@code .yaml} file of a directory, in file name order.
     */
    public List<WorkflowDefinition> loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.warn("Workflow directory {} does not exist", directory);
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            List<WorkflowDefinition> definitions = new ArrayList<>();
            for (Path file : files.filter(WorkflowLoader::isYaml).sorted().toList()) {
                definitions.add(load(file));
            }
            return definitions;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list workflow directory " + directory, e);
        }
    }

    public WorkflowDefinition load(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8), baseName(file.getFileName().toString()));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read workflow file " + file, e);
        }
    }

    public WorkflowDefinition load(InputStream in, String sourceName) throws IOException {
        return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), baseName(sourceName));
    }

    /**
     * Parse a workflow document.
     *
     * @param document YAML text
     * @param defaultName Name used when the document has no {@code name}
     * @throws ConfigurationException if the document is malformed
     */
    public WorkflowDefinition parse(String document, String defaultName) {
        JsonNode root;
        try {
            root = yaml.readTree(document);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(defaultName, "not valid YAML: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException(defaultName, "expected a workflow mapping");
        }

        String name = YamlNodes.text(root, "name");
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name(name != null && !name.isBlank() ? name : defaultName)
            .description(YamlNodes.text(root, "description"))
            .trigger(parseTrigger(triggerNode(root), YamlNodes.text(root, "skip-marker")))
            .env(YamlNodes.stringMap(root.get("env"), "env"))
            .permissions(YamlNodes.stringMap(root.get("permissions"), "permissions"))
            .jobs(parseJobs(root.get("jobs")))
            .build();
        log.debug("Parsed workflow {} with {} jobs", definition.name(), definition.jobs().size());
        return definition;
    }

    // ========== Internal Methods ==========

    private static JsonNode triggerNode(JsonNode root) {
        JsonNode on = root.get("on");
        // YAML 1.1 parsers may read an unquoted "on" key as boolean true
        return on != null ? on : root.get("true");
    }

    private TriggerSpec parseTrigger(JsonNode on, String skipMarker) {
        TriggerSpec.Builder builder = TriggerSpec.builder();
        if (skipMarker != null) {
            builder.skipMarker(skipMarker);
        }
        if (on == null || on.isNull()) {
            return builder.build();
        }

        Set<String> events = new LinkedHashSet<>();
        List<String> branches = new ArrayList<>();
        List<String> pathsIgnore = new ArrayList<>();

        if (on.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = on.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String event = checkEvent(field.getKey());
                events.add(event);
                JsonNode filters = field.getValue();
                if (filters != null && filters.isObject()) {
                    List<String> eventBranches = YamlNodes.stringList(filters.get("branches"), "on." + event + ".branches");
                    List<String> eventIgnores = YamlNodes.stringList(filters.get("paths-ignore"), "on." + event + ".paths-ignore");
                    WorkflowValidator.checkGlobs(eventBranches, "on." + event + ".branches");
                    WorkflowValidator.checkGlobs(eventIgnores, "on." + event + ".paths-ignore");
                    branches.addAll(eventBranches);
                    pathsIgnore.addAll(eventIgnores);
                }
            }
        } else {
            for (String event : YamlNodes.stringList(on, "on")) {
                events.add(checkEvent(event));
            }
        }

        return builder
            .events(events)
            .branches(List.copyOf(new LinkedHashSet<>(branches)))
            .pathsIgnore(List.copyOf(new LinkedHashSet<>(pathsIgnore)))
            .manualDispatch(events.contains(EventKind.MANUAL_DISPATCH.triggerName()))
            .build();
    }

    private static String checkEvent(String event) {
        for (EventKind kind : EventKind.values()) {
            if (kind.triggerName().equals(event)) {
                return event;
            }
        }
        throw new ConfigurationException("on." + event, "unsupported event");
    }

    private List<JobDefinition> parseJobs(JsonNode jobs) {
        if (jobs == null || jobs.isNull()) {
            return List.of();
        }
        if (!jobs.isObject()) {
            throw new ConfigurationException("jobs", "expected a mapping of job ids to jobs");
        }
        List<JobDefinition> result = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = jobs.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            result.add(parseJob(field.getKey(), field.getValue()));
        }
        return result;
    }

    private JobDefinition parseJob(String jobId, JsonNode node) {
        String location = "jobs." + jobId;
        if (node == null || !node.isObject()) {
            throw new ConfigurationException(location, "expected a job mapping");
        }
        JobDefinition.Builder builder = JobDefinition.builder()
            .jobId(jobId)
            .displayName(YamlNodes.text(node, "name"))
            .needs(new LinkedHashSet<>(YamlNodes.stringList(node.get("needs"), location + ".needs")))
            .runsOn(YamlNodes.text(node, "runs-on"))
            .condition(YamlNodes.text(node, "if"))
            .environment(environmentName(node.get("environment"), location))
            .env(YamlNodes.stringMap(node.get("env"), location + ".env"))
            .steps(YamlNodes.steps(node.get("steps"), location + ".steps"));

        String timeout = YamlNodes.text(node, "timeout-minutes");
        if (timeout != null) {
            try {
                builder.timeout(Duration.ofMinutes(Long.parseLong(timeout.trim())));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(location + ".timeout-minutes", "not a whole number: " + timeout);
            }
        }
        return builder.build();
    }

    private static String environmentName(JsonNode node, String location) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        if (node.isObject() && node.hasNonNull("name")) {
            return node.get("name").asText();
        }
        throw new ConfigurationException(location + ".environment", "expected a name");
    }

    static boolean isYaml(Path file) {
        String name = file.getFileName().toString();
        return Files.isRegularFile(file) && (name.endsWith(".yml") || name.endsWith(".yaml"));
    }

    static String baseName(String fileName) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String name = fileName.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
