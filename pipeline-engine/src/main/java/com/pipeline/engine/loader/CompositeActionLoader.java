package com.pipeline.engine.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.pipeline.actions.DeclaredCompositeAction;
import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.InputSpec;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.StepDefinition;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Reads composite actions declared in YAML.
 *
 * <pre>
 * name: setup-node-deps
 * description: Restore, install and save node dependencies
 * inputs:
 *   path:
 *     default: node_modules
 * runs:
 *   steps:
 *     - id: restore
 *       uses: cache-restore
 *       with:
 *         path: ${{ inputs.path }}
 *     - if: steps.restore.outputs['cache-hit'] != 'true'
 *       run: npm ci
 * outputs:
 *   cache-hit: ${{ steps.restore.outputs.cache-hit }}
 * </pre>
 *
 * An input is required unless it has a default or says {@code required: false}.
 * An output may also be written as a mapping with a {@code value} key.
 */
public class CompositeActionLoader {

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    public List<DeclaredCompositeAction> loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            List<DeclaredCompositeAction> actions = new ArrayList<>();
            for (Path file : files.filter(WorkflowLoader::isYaml).sorted().toList()) {
                actions.add(load(file));
            }
            return actions;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list action directory " + directory, e);
        }
    }

    public DeclaredCompositeAction load(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8),
                WorkflowLoader.baseName(file.getFileName().toString()));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read action file " + file, e);
        }
    }

    public DeclaredCompositeAction load(InputStream in, String sourceName) throws IOException {
        return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), WorkflowLoader.baseName(sourceName));
    }

    /**
     * Parse an action document.
     *
     * @throws ConfigurationException if the document is malformed or declares no steps
     */
    public DeclaredCompositeAction parse(String document, String defaultName) {
        JsonNode root;
        try {
            root = yaml.readTree(document);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(defaultName, "not valid YAML: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException(defaultName, "expected an action mapping");
        }

        String name = YamlNodes.text(root, "name");
        name = name != null && !name.isBlank() ? name : defaultName;
        String location = "actions." + name;

        JsonNode runs = root.get("runs");
        List<StepDefinition> steps = runs != null && runs.isObject()
            ? YamlNodes.steps(runs.get("steps"), location + ".runs.steps")
            : List.of();
        if (steps.isEmpty()) {
            throw new ConfigurationException(location + ".runs.steps", "an action needs at least one step");
        }

        return new DeclaredCompositeAction(
            name,
            YamlNodes.text(root, "description"),
            parseInputs(root.get("inputs"), location + ".inputs"),
            JobDefinition.withStepIds(steps),
            parseOutputs(root.get("outputs"), location + ".outputs"));
    }

    // ========== Internal Methods ==========

    private static List<InputSpec> parseInputs(JsonNode node, String location) {
        List<InputSpec> inputs = new ArrayList<>();
        if (node == null || node.isNull()) {
            return inputs;
        }
        if (!node.isObject()) {
            throw new ConfigurationException(location, "expected a mapping of input names");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode spec = field.getValue();
            if (spec == null || spec.isNull()) {
                inputs.add(InputSpec.required(field.getKey(), null));
                continue;
            }
            String defaultValue = YamlNodes.text(spec, "default");
            String description = YamlNodes.text(spec, "description");
            boolean required = YamlNodes.bool(spec, "required", defaultValue == null);
            inputs.add(required && defaultValue == null
                ? InputSpec.required(field.getKey(), description)
                : new InputSpec(field.getKey(), required, defaultValue, description));
        }
        return inputs;
    }

    private static Map<String, String> parseOutputs(JsonNode node, String location) {
        Map<String, String> outputs = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return outputs;
        }
        if (!node.isObject()) {
            throw new ConfigurationException(location, "expected a mapping of output names");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isObject()) {
                outputs.put(field.getKey(), Objects.requireNonNullElse(YamlNodes.text(value, "value"), ""));
            } else {
                outputs.put(field.getKey(), value.isNull() ? "" : value.asText());
            }
        }
        return outputs;
    }
}
