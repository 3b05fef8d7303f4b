package com.lexcoach.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lexcoach.orchestration.model.RunOutcome;
import com.lexcoach.orchestration.model.ToolResult;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatResponse(
        String status,
        String runId,
        Instant createdAt,
        String answer,
        PendingApprovalResponse approval,
        List<ToolResult> toolResults,
        String failureReason,
        Boolean retryable
) {

    public static final String COMPLETED = "COMPLETED";
    public static final String PENDING_APPROVAL = "PENDING_APPROVAL";
    public static final String FAILED = "FAILED";

    public static ChatResponse from(RunOutcome outcome) {
        if (outcome instanceof RunOutcome.Completed completed) {
            return new ChatResponse(COMPLETED, completed.runId(), Instant.now(), completed.answer(), null,
                    completed.toolResults(), null, null);
        }
        if (outcome instanceof RunOutcome.PendingApproval pending) {
            return new ChatResponse(PENDING_APPROVAL, pending.runId(), Instant.now(), null,
                    PendingApprovalResponse.from(pending.request()), null, null, null);
        }
        RunOutcome.Failed failed = (RunOutcome.Failed) outcome;
        return new ChatResponse(FAILED, failed.runId(), Instant.now(), failed.answer(), null, null,
                failed.reason(), failed.retryable());
    }
}
