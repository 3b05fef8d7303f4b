package com.lexcoach.orchestration;

import static com.lexcoach.orchestration.OrchestrationConstants.*;

import com.lexcoach.config.CoachProperties;
import com.lexcoach.orchestration.api.CheckpointStore;
import com.lexcoach.orchestration.api.MemoryStore;
import com.lexcoach.orchestration.exception.PlanningFailureException;
import com.lexcoach.orchestration.exception.RunAlreadyResolvedException;
import com.lexcoach.orchestration.exception.UnknownRunException;
import com.lexcoach.orchestration.model.ApprovalDecision;
import com.lexcoach.orchestration.model.ApprovalRequest;
import com.lexcoach.orchestration.model.DecisionType;
import com.lexcoach.orchestration.model.Plan;
import com.lexcoach.orchestration.model.RunOutcome;
import com.lexcoach.orchestration.model.RunState;
import com.lexcoach.orchestration.model.RunStatus;
import com.lexcoach.orchestration.model.SessionKey;
import com.lexcoach.orchestration.model.Turn;
import com.lexcoach.orchestration.service.ApprovalGate;
import com.lexcoach.orchestration.service.PlannerNode;
import com.lexcoach.orchestration.service.ResponderNode;
import com.lexcoach.orchestration.service.RunAuditService;
import com.lexcoach.orchestration.service.ToolExecutionNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives a run through planning, approval, tool execution and response. Each {@code start} or {@code resume}
 * call advances the run synchronously until it completes, aborts or suspends for a human decision.
 * A suspended run lives only in the checkpoint store, so any instance can resume it.
 */
@Service
@Slf4j
public class WorkflowOrchestrator {

    static final String CANCELLED_REASON = "Cancelled by user";

    private final PlannerNode plannerNode;
    private final ApprovalGate approvalGate;
    private final ToolExecutionNode toolExecutionNode;
    private final ResponderNode responderNode;
    private final CheckpointStore checkpointStore;
    private final MemoryStore memoryStore;
    private final RunAuditService auditService;
    private final CoachProperties properties;
    private final AtomicLong startedRuns = new AtomicLong();
    private final AtomicLong suspendedRuns = new AtomicLong();

    public WorkflowOrchestrator(PlannerNode plannerNode,
                                ApprovalGate approvalGate,
                                ToolExecutionNode toolExecutionNode,
                                ResponderNode responderNode,
                                CheckpointStore checkpointStore,
                                MemoryStore memoryStore,
                                RunAuditService auditService,
                                CoachProperties properties) {
        this.plannerNode = plannerNode;
        this.approvalGate = approvalGate;
        this.toolExecutionNode = toolExecutionNode;
        this.responderNode = responderNode;
        this.checkpointStore = checkpointStore;
        this.memoryStore = memoryStore;
        this.auditService = auditService;
        this.properties = properties;
    }

    public RunOutcome start(Turn turn) {
        RunState state = RunState.start(turn);
        log.info("Run {} started for session {} (run #{}).", state.runId(), turn.session(), startedRuns.incrementAndGet());
        auditService.recordTransition(state);
        return drive(state);
    }

    /**
     * Applies a human decision to a suspended run and drives it to its next stop point.
     *
     * @throws UnknownRunException if no run with this id was ever suspended
     * @throws RunAlreadyResolvedException if the run was already resumed, cancelled or is being resumed concurrently
     */
    public RunOutcome resume(String runId, ApprovalDecision decision) {
        Objects.requireNonNull(decision, "decision");
        RunState suspended = checkpointStore.claim(runId);
        if (suspended.status() != RunStatus.AWAITING_APPROVAL) {
            log.warn("Run {} was claimed in unexpected status {}.", runId, suspended.status());
            throw new RunAlreadyResolvedException(runId);
        }
        log.info("Run {} resumed with decision {}.", runId, decision.type());
        RunState decided = suspended.withDecision(decision);
        RunState next = decision.type() == DecisionType.APPROVE
                ? decided.executing()
                : decided.responding(List.of());
        auditService.recordTransition(next);
        return drive(next);
    }

    /**
     * Resumes the newest run of the session that is awaiting approval.
     */
    public RunOutcome resumeLatest(SessionKey session, ApprovalDecision decision) {
        List<RunState> pending = checkpointStore.findPending(session);
        if (pending.isEmpty()) {
            throw UnknownRunException.noPendingRun(session);
        }
        return resume(pending.get(0).runId(), decision);
    }

    /**
     * @return {@code true} if a suspended run was cancelled, {@code false} if it was unknown or already resolved
     */
    public boolean cancel(String runId) {
        RunState suspended;
        try {
            suspended = checkpointStore.claim(runId);
        } catch (UnknownRunException | RunAlreadyResolvedException ex) {
            log.info("Cancel of run {} ignored: {}", runId, ex.getMessage());
            return false;
        }
        RunState aborted = suspended.aborted(CANCELLED_REASON);
        auditService.recordTransition(aborted);
        checkpointStore.resolve(runId, RunStatus.ABORTED);
        log.info("Run {} cancelled.", runId);
        return true;
    }

    public List<ApprovalRequest> findPending(SessionKey session) {
        return checkpointStore.findPending(session).stream()
                .map(RunState::approvalRequest)
                .filter(Objects::nonNull)
                .toList();
    }

    public List<Turn> history(SessionKey session, int limit) {
        return memoryStore.recent(session, Math.max(1, limit));
    }

    private RunOutcome drive(RunState initial) {
        RunState state = initial;
        try {
            while (!state.status().isStopPoint()) {
                state = advance(state);
                auditService.recordTransition(state);
            }
            return settle(state);
        } catch (PlanningFailureException ex) {
            return abort(state, ex.getMessage(), PLANNING_FAILED_MESSAGE, true);
        } catch (RuntimeException ex) {
            log.error("Run {} failed in status {}: {}", state.runId(), state.status(), ex.getMessage(), ex);
            return abort(state, ex.getClass().getSimpleName() + ": " + ex.getMessage(), RUN_FAILED_MESSAGE, false);
        }
    }

    private RunState advance(RunState state) {
        return switch (state.status()) {
            case PLANNING -> plan(state);
            case EXECUTING -> state.responding(toolExecutionNode.execute(state.runId(), state.plan()));
            case RESPONDING -> state.completed(responderNode.respond(state, memory(state.turn().session())));
            case AWAITING_APPROVAL, COMPLETED, ABORTED ->
                    throw new IllegalStateException("Run " + state.runId() + " cannot advance from " + state.status());
        };
    }

    private RunState plan(RunState state) {
        Plan plan = plannerNode.plan(state.turn(), memory(state.turn().session()));
        RunState planned = state.withPlan(plan);
        auditService.recordTransition(planned);
        Optional<ApprovalRequest> approval = approvalGate.evaluate(state.runId(), state.turn(), plan);
        if (approval.isPresent()) {
            return planned.awaitingApproval(approval.get());
        }
        return plan.isEmpty() ? planned.responding(List.of()) : planned.executing();
    }

    private RunOutcome settle(RunState state) {
        switch (state.status()) {
            case AWAITING_APPROVAL -> {
                checkpointStore.put(state.runId(), state);
                log.info("Run {} suspended awaiting approval ({} runs suspended so far).", state.runId(),
                        suspendedRuns.incrementAndGet());
                return new RunOutcome.PendingApproval(state.approvalRequest());
            }
            case COMPLETED -> {
                memoryStore.append(state.turn().session(), state.turn());
                checkpointStore.resolve(state.runId(), RunStatus.COMPLETED);
                log.info("Run {} completed.", state.runId());
                return new RunOutcome.Completed(state.runId(), state.turn().answer(), state.plan(), state.toolResults());
            }
            default -> {
                return abort(state, state.failureReason(), RUN_FAILED_MESSAGE, false);
            }
        }
    }

    private RunOutcome abort(RunState state, String reason, String answer, boolean retryable) {
        RunState aborted = state.status() == RunStatus.ABORTED ? state : state.aborted(reason);
        log.warn("Run {} aborted: {}", aborted.runId(), reason);
        auditService.recordTransition(aborted);
        try {
            checkpointStore.resolve(aborted.runId(), RunStatus.ABORTED);
        } catch (RuntimeException ex) {
            log.warn("Failed to clean up checkpoint of aborted run {}: {}", aborted.runId(), ex.getMessage());
        }
        return new RunOutcome.Failed(aborted.runId(), reason, answer, retryable);
    }

    private List<Turn> memory(SessionKey session) {
        return memoryStore.recent(session, properties.getMemory().getWindow());
    }
}
