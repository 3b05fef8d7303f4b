package com.lexcoach.orchestration.model;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

public record ApprovalDecision(
        DecisionType type,
        @Nullable String feedback
) {

    public ApprovalDecision {
        if (type == null) {
            throw new IllegalArgumentException("decision type is required");
        }
        feedback = StringUtils.hasText(feedback) ? feedback.trim() : null;
    }

    public static ApprovalDecision approve() {
        return new ApprovalDecision(DecisionType.APPROVE, null);
    }

    public static ApprovalDecision reject(@Nullable String feedback) {
        return new ApprovalDecision(DecisionType.REJECT, feedback);
    }

    public static ApprovalDecision modify(String feedback) {
        return new ApprovalDecision(DecisionType.MODIFY, feedback);
    }
}
