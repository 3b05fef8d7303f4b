package com.lexcoach.orchestration.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Raw planner output as the model returns it. Untrusted until {@link PlannerNode} has sanitized it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlannerReply(
        @JsonProperty("needs_tools") Boolean needsTools,
        String reasoning,
        Double confidence,
        @JsonProperty("tools_to_use") List<PlannedTool> toolsToUse
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlannedTool(
            @JsonProperty("tool_name") String toolName,
            Map<String, Object> parameters,
            String reason
    ) {
    }
}
