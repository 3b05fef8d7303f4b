package com.lexcoach.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Everything a run needs to continue on another thread or process. Serialized as JSON into the checkpoint store
 * while the run is suspended, so nothing run-scoped may live outside this record.
 */
public record RunState(
        String runId,
        Turn turn,
        WorkflowNode position,
        @Nullable Plan plan,
        List<ToolResult> toolResults,
        RunStatus status,
        @Nullable ApprovalRequest approvalRequest,
        @Nullable ApprovalDecision decision,
        @Nullable String failureReason,
        Instant updatedAt
) {

    public RunState {
        toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
    }

    public static RunState start(Turn turn) {
        String runId = UUID.randomUUID().toString();
        return new RunState(runId, turn.withRunId(runId), WorkflowNode.PLANNER, null, List.of(),
                RunStatus.PLANNING, null, null, null, Instant.now());
    }

    public RunState withPlan(Plan plan) {
        return new RunState(runId, turn, WorkflowNode.APPROVAL_GATE, plan, toolResults, status,
                approvalRequest, decision, failureReason, Instant.now());
    }

    public RunState awaitingApproval(ApprovalRequest request) {
        return new RunState(runId, turn, WorkflowNode.APPROVAL_GATE, plan, toolResults, RunStatus.AWAITING_APPROVAL,
                request, decision, failureReason, Instant.now());
    }

    public RunState executing() {
        return new RunState(runId, turn, WorkflowNode.TOOL_EXECUTION, plan, toolResults, RunStatus.EXECUTING,
                null, decision, failureReason, Instant.now());
    }

    public RunState responding(List<ToolResult> results) {
        return new RunState(runId, turn, WorkflowNode.RESPONDER, plan, results, RunStatus.RESPONDING,
                null, decision, failureReason, Instant.now());
    }

    public RunState withDecision(ApprovalDecision decision) {
        Turn next = decision.type() == DecisionType.APPROVE ? turn : turn.withFeedback(decision.feedback());
        return new RunState(runId, next, position, plan, toolResults, status, approvalRequest, decision,
                failureReason, Instant.now());
    }

    public RunState completed(String answer) {
        return new RunState(runId, turn.withAnswer(answer), WorkflowNode.END, plan, toolResults, RunStatus.COMPLETED,
                null, decision, null, Instant.now());
    }

    public RunState aborted(String reason) {
        return new RunState(runId, turn, WorkflowNode.END, plan, toolResults, RunStatus.ABORTED,
                null, decision, reason, Instant.now());
    }
}
