package com.lexcoach.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ToolInvocation(
        String toolName,
        Map<String, Object> arguments,
        @Nullable String rationale,
        boolean structuredValidation
) {

    public ToolInvocation {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
