package com.z254.insight.prism.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.insight.prism.error.IssueSourceException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads issue records from a JSON file.
 * <p>
 * Two layouts are accepted:
 * <ul>
 *     <li>an array of flat records, as exported from a spreadsheet</li>
 *     <li>an issue-tracker search response, {@code {"issues": [{"key": ..., "fields": {...}}]}}</li>
 * </ul>
 * Search responses are flattened: {@code key} plus every entry of {@code fields}, where
 * objects carrying {@code name}, {@code displayName} or {@code value} become that string
 * and arrays become comma-joined strings.
 */
@Slf4j
public class JsonFileIssueSource implements IssueSource {

    private static final List<String> NAME_KEYS = List.of("name", "displayName", "value");
    private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper mapper;

    public JsonFileIssueSource(Path path, ObjectMapper mapper) {
        this.path = path;
        this.mapper = mapper;
    }

    @Override
    public List<Map<String, Object>> fetch() {
        if (!Files.isReadable(path)) {
            throw new IssueSourceException("Issue file is not readable: " + path);
        }
        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (JsonProcessingException e) {
            throw new IssueSourceException("Issue file " + path + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IssueSourceException("Failed to read issue file " + path, e);
        }

        List<Map<String, Object>> records;
        if (root != null && root.isArray()) {
            records = readFlat(root);
        } else if (root != null && root.path("issues").isArray()) {
            records = readSearchResponse(root.path("issues"));
        } else {
            throw new IssueSourceException("Unsupported layout in " + path
                    + ": expected an array of records or an object with an 'issues' array");
        }
        log.info("Read {} records from {}", records.size(), path);
        return records;
    }

    @Override
    public String describe() {
        return "json:" + path;
    }

    private List<Map<String, Object>> readFlat(JsonNode array) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (JsonNode node : array) {
            // null entries are kept so the normalizer can report them
            records.add(node.isObject() ? mapper.convertValue(node, RECORD) : null);
        }
        return records;
    }

    private List<Map<String, Object>> readSearchResponse(JsonNode issues) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (JsonNode issue : issues) {
            if (!issue.isObject()) {
                records.add(null);
                continue;
            }
            Map<String, Object> record = new LinkedHashMap<>();
            if (issue.hasNonNull("key")) {
                record.put("key", issue.get("key").asText());
            }
            Iterator<Map.Entry<String, JsonNode>> fields = issue.path("fields").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Object value = flatten(field.getValue());
                if (value != null) {
                    record.put(field.getKey(), value);
                }
            }
            records.add(record);
        }
        return records;
    }

    private Object flatten(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            for (String key : NAME_KEYS) {
                if (node.hasNonNull(key)) {
                    return node.get(key).asText();
                }
            }
            return mapper.convertValue(node, RECORD);
        }
        if (node.isArray()) {
            StringJoiner joined = new StringJoiner(", ");
            for (JsonNode element : node) {
                Object value = flatten(element);
                if (value != null) {
                    joined.add(value.toString());
                }
            }
            return joined.toString();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }
}
