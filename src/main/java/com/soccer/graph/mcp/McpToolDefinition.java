package com.soccer.graph.mcp;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A read-only query exposed to an LLM agent over the Model Context Protocol.
 *
 * @param name        tool name, e.g. {@code get_standings}
 * @param description what the tool answers
 * @param inputSchema JSON Schema of the arguments
 * @param handler     runs the query on the parsed arguments and returns a JSON-ready map
 */
public record McpToolDefinition(
        String name,
        String description,
        Map<String, Object> inputSchema,
        Function<Map<String, Object>, Map<String, Object>> handler
) {
    public McpToolDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(inputSchema, "inputSchema is required");
        Objects.requireNonNull(handler, "handler is required");
        inputSchema = Map.copyOf(inputSchema);
    }

    public Map<String, Object> call(Map<String, Object> arguments) {
        return handler.apply(arguments != null ? arguments : Map.of());
    }
}
