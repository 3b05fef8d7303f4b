package com.lexcoach.orchestration.model;

import java.util.List;

/**
 * What a single {@code start} or {@code resume} call hands back to the transport layer.
 */
public sealed interface RunOutcome permits RunOutcome.Completed, RunOutcome.PendingApproval, RunOutcome.Failed {

    String runId();

    record Completed(String runId, String answer, Plan plan, List<ToolResult> toolResults) implements RunOutcome {
    }

    record PendingApproval(ApprovalRequest request) implements RunOutcome {

        @Override
        public String runId() {
            return request.runId();
        }
    }

    /**
     * {@code answer} is always a user-presentable apology; {@code retryable} separates transient provider trouble
     * from terminal failures.
     */
    record Failed(String runId, String reason, String answer, boolean retryable) implements RunOutcome {
    }
}
