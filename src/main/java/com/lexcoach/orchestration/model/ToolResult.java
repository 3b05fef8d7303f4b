package com.lexcoach.orchestration.model;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.Nullable;

/**
 * Outcome of one invocation: either {@code payload} or {@code failure} is set, never both.
 */
public record ToolResult(
        int invocationIndex,
        String toolName,
        boolean success,
        @Nullable JsonNode payload,
        @Nullable ToolFailure failure
) {

    public static ToolResult success(int index, String toolName, JsonNode payload) {
        return new ToolResult(index, toolName, true, payload, null);
    }

    public static ToolResult failure(int index, String toolName, FailureKind kind, String message) {
        return new ToolResult(index, toolName, false, null, new ToolFailure(kind, message));
    }
}
