package com.lexcoach.tools;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.Nullable;

public record RegisteredTool(
        CoachingTool tool,
        boolean sensitive,
        boolean strictValidation
) {

    public String name() {
        return tool.name();
    }

    public @Nullable JsonNode schema() {
        return tool.schema().orElse(null);
    }

    public boolean declaresArgument(String argument) {
        JsonNode schema = schema();
        return schema != null && schema.path("properties").has(argument);
    }
}
