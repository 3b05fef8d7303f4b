package com.lexcoach.api;

import com.lexcoach.orchestration.model.ApprovalRequest;
import com.lexcoach.orchestration.model.ToolInvocation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record PendingApprovalResponse(
        String runId,
        double confidence,
        String reason,
        String reasoning,
        List<PlannedTool> plannedTools,
        Instant requestedAt
) {

    public static PendingApprovalResponse from(ApprovalRequest request) {
        List<PlannedTool> tools = request.plan().invocations().stream()
                .map(PlannedTool::from)
                .toList();
        return new PendingApprovalResponse(request.runId(), request.confidence(), request.reason(),
                request.plan().reasoning(), tools, request.requestedAt());
    }

    public record PlannedTool(String toolName, Map<String, Object> arguments, String rationale) {

        static PlannedTool from(ToolInvocation invocation) {
            return new PlannedTool(invocation.toolName(), invocation.arguments(), invocation.rationale());
        }
    }
}
