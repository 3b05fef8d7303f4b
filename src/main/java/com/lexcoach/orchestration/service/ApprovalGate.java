package com.lexcoach.orchestration.service;

import com.lexcoach.config.CoachProperties;
import com.lexcoach.orchestration.model.ApprovalRequest;
import com.lexcoach.orchestration.model.Plan;
import com.lexcoach.orchestration.model.ToolInvocation;
import com.lexcoach.orchestration.model.Turn;
import com.lexcoach.tools.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a plan needs human sign-off. Pure function of the plan, the registry and configuration.
 */
@Service
@Slf4j
public class ApprovalGate {

    private final ToolRegistry toolRegistry;
    private final ConfidenceAssessor confidenceAssessor;
    private final CoachProperties properties;

    public ApprovalGate(ToolRegistry toolRegistry, ConfidenceAssessor confidenceAssessor, CoachProperties properties) {
        this.toolRegistry = toolRegistry;
        this.confidenceAssessor = confidenceAssessor;
        this.properties = properties;
    }

    /**
     * @return the approval request when the run must suspend, empty when the plan passes through unchanged
     */
    public Optional<ApprovalRequest> evaluate(String runId, Turn turn, Plan plan) {
        if (plan.isEmpty() || !properties.getApproval().isEnabled()) {
            return Optional.empty();
        }
        List<String> sensitive = sensitiveTools(plan);
        double threshold = properties.getApproval().getThreshold();
        boolean lowConfidence = plan.confidence() < threshold;
        if (!lowConfidence && sensitive.isEmpty()) {
            log.info("APPROVAL: plan of run {} passed (confidence={} >= threshold={}).", runId, plan.confidence(), threshold);
            return Optional.empty();
        }
        String reason = confidenceAssessor.approvalReason(plan.confidence(), turn.userText(), sensitive);
        log.info("APPROVAL: run {} suspended. {}", runId, reason);
        return Optional.of(new ApprovalRequest(runId, plan, plan.confidence(), reason, Instant.now()));
    }

    private List<String> sensitiveTools(Plan plan) {
        return plan.invocations().stream()
                .map(ToolInvocation::toolName)
                .filter(toolRegistry::isSensitive)
                .distinct()
                .toList();
    }
}
