package com.lexcoach.orchestration.service;

import com.lexcoach.entity.ToolCallLog;
import com.lexcoach.entity.WorkflowRunLog;
import com.lexcoach.orchestration.model.RunState;
import com.lexcoach.orchestration.model.ToolInvocation;
import com.lexcoach.orchestration.model.ToolResult;
import com.lexcoach.repository.ToolCallLogRepository;
import com.lexcoach.repository.WorkflowRunLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Writes the audit trail of runs: one {@code workflow_run} row updated on every transition and one
 * {@code tool_call_log} row per executed invocation. Audit failures are logged and never fail the run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunAuditService {

    private static final int MAX_SNIPPET = 4000;

    private final WorkflowRunLogRepository runLogRepository;
    private final ToolCallLogRepository toolCallLogRepository;
    private final JsonProcessingService jsonProcessingService;

    public void recordTransition(RunState state) {
        log.info("Run {} transitioned to {} at {}.", state.runId(), state.status(), state.position());
        try {
            WorkflowRunLog entry = runLogRepository.findById(state.runId())
                    .orElseGet(() -> WorkflowRunLog.builder()
                            .runId(state.runId())
                            .userId(state.turn().session().userId())
                            .sessionId(state.turn().session().sessionId())
                            .userPrompt(state.turn().userText())
                            .build());
            entry.setStatus(state.status().name());
            entry.setPosition(state.position().name());
            if (state.plan() != null) {
                entry.setConfidence(state.plan().confidence());
                entry.setPlanJson(jsonProcessingService.toCompactJson(state.plan()));
            }
            if (state.decision() != null) {
                entry.setDecision(state.decision().type().name());
            }
            entry.setFinalAnswer(state.turn().answer());
            entry.setFailureReason(state.failureReason());
            runLogRepository.save(entry);
        } catch (Exception ex) {
            log.warn("Failed to record transition of run {}: {}", state.runId(), ex.getMessage());
        }
    }

    public void logToolCall(String runId, ToolInvocation invocation, ToolResult result) {
        try {
            String output = result.success()
                    ? jsonProcessingService.toCompactJson(result.payload())
                    : result.failure().message();
            ToolCallLog entry = ToolCallLog.builder()
                    .runId(runId)
                    .invocationIndex(result.invocationIndex())
                    .toolName(invocation.toolName())
                    .toolInput(jsonProcessingService.truncate(jsonProcessingService.toCompactJson(invocation.arguments()), MAX_SNIPPET))
                    .toolOutput(jsonProcessingService.truncate(output, MAX_SNIPPET))
                    .success(result.success())
                    .failureKind(result.success() ? null : result.failure().kind().name())
                    .build();
            toolCallLogRepository.save(entry);
        } catch (Exception ex) {
            log.warn("Failed to log tool call {} of run {}: {}", invocation.toolName(), runId, ex.getMessage());
        }
    }
}
