package com.lexcoach.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record Plan(
        List<ToolInvocation> invocations,
        double confidence,
        String reasoning
) {

    public static final double NO_TOOL_CONFIDENCE = 1.0;

    public Plan {
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        reasoning = reasoning == null ? "" : reasoning;
    }

    public static Plan noTools(String reasoning) {
        return new Plan(List.of(), NO_TOOL_CONFIDENCE, reasoning);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return invocations.isEmpty();
    }
}
