package com.lexcoach.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;

/**
 * A capability the planner may ask for by name.
 */
public interface CoachingTool {

    String name();

    String description();

    /**
     * Whether a plan using this tool always needs human approval.
     */
    default boolean sensitive() {
        return false;
    }

    /**
     * JSON Schema of the arguments object, when the tool declares one.
     */
    default Optional<JsonNode> schema() {
        return Optional.empty();
    }

    /**
     * Runs the tool. The returned value is treated as an opaque payload; strings holding JSON are parsed.
     *
     * @throws Exception any failure, reported back as a failed tool result
     */
    Object invoke(Map<String, Object> arguments) throws Exception;
}
