package com.lexcoach.api;

import com.lexcoach.orchestration.model.DecisionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * A reviewer decision. Without {@code runId} the newest run of the session awaiting approval is resolved.
 */
public record DecisionRequest(
        @NotBlank String userId,
        String sessionId,
        String runId,
        @NotNull DecisionType decision,
        String feedback
) {
}
