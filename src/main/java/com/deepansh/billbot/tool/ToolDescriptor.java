package com.deepansh.billbot.tool;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of one tool from the worker's catalog.
 * {@code inputSchema} is the JSON Schema the worker advertised.
 */
@Data
@Builder(toBuilder = true)
public class ToolDescriptor {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    static ToolDescriptor from(JsonNode node, ObjectMapper objectMapper) {
        JsonNode schema = node.path("inputSchema");
        Map<String, Object> schemaMap = schema.isObject()
                ? objectMapper.convertValue(schema, new TypeReference<>() {})
                : Map.of("type", "object");
        return ToolDescriptor.builder()
                .name(node.path("name").asText())
                .description(node.path("description").asText(""))
                .inputSchema(schemaMap)
                .build();
    }

    /** Names listed under the schema's "required" key. */
    public List<String> requiredArguments() {
        if (inputSchema == null) return List.of();
        Object required = inputSchema.get("required");
        if (required instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
