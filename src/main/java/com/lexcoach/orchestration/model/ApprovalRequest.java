package com.lexcoach.orchestration.model;

import java.time.Instant;

public record ApprovalRequest(
        String runId,
        Plan plan,
        double confidence,
        String reason,
        Instant requestedAt
) {
}
