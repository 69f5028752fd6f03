package com.pipeline.engine.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.StepDefinition;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions from parsed YAML trees to model values, shared by the loaders.
 * Scalars of any type are read as text; YAML nulls become empty strings.
 */
final class YamlNodes {

    private YamlNodes() {
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new ConfigurationException(field, "expected a scalar value");
        }
        return value.asText();
    }

    static boolean bool(JsonNode node, String field, boolean fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        return value.isBoolean() ? value.asBoolean() : Boolean.parseBoolean(value.asText());
    }

    /**
     * A mapping of scalars, e.g. {@code env} or {@code with}.
     */
    static Map<String, String> stringMap(JsonNode node, String location) {
        Map<String, String> result = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (!node.isObject()) {
            throw new ConfigurationException(location, "expected a mapping");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                result.put(field.getKey(), "");
            } else if (value.isValueNode()) {
                result.put(field.getKey(), value.asText());
            } else {
                throw new ConfigurationException(location + "." + field.getKey(), "expected a scalar value");
            }
        }
        return result;
    }

    /**
     * A single string or a list of strings.
     */
    static List<String> stringList(JsonNode node, String location) {
        List<String> result = new ArrayList<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (node.isValueNode()) {
            result.add(node.asText());
            return result;
        }
        if (!node.isArray()) {
            throw new ConfigurationException(location, "expected a string or a list of strings");
        }
        for (JsonNode item : node) {
            if (!item.isValueNode()) {
                throw new ConfigurationException(location, "expected a list of strings");
            }
            result.add(item.asText());
        }
        return result;
    }

    static List<StepDefinition> steps(JsonNode node, String location) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigurationException(location, "expected a list of steps");
        }
        List<StepDefinition> steps = new ArrayList<>();
        int index = 0;
        for (JsonNode step : node) {
            steps.add(step(step, location + "[" + index + "]"));
            index++;
        }
        return steps;
    }

    static StepDefinition step(JsonNode node, String location) {
        if (!node.isObject()) {
            throw new ConfigurationException(location, "expected a step mapping");
        }
        return StepDefinition.builder()
            .stepId(text(node, "id"))
            .name(text(node, "name"))
            .run(text(node, "run"))
            .uses(text(node, "uses"))
            .with(stringMap(node.get("with"), location + ".with"))
            .condition(text(node, "if"))
            .continueOnError(bool(node, "continue-on-error", false))
            .env(stringMap(node.get("env"), location + ".env"))
            .build();
    }
}
