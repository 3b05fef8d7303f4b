package com.lexcoach.orchestration.api;

import com.lexcoach.orchestration.exception.RunAlreadyResolvedException;
import com.lexcoach.orchestration.exception.UnknownRunException;
import com.lexcoach.orchestration.model.RunState;
import com.lexcoach.orchestration.model.RunStatus;
import com.lexcoach.orchestration.model.SessionKey;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for suspended runs, keyed by run identifier. The orchestrator is the only writer.
 * Implementations must make {@link #claim(String)} atomic so two concurrent decisions for the same run
 * can never both proceed to tool execution.
 */
public interface CheckpointStore {

    /**
     * Stores or replaces the snapshot for {@code runId}.
     *
     * @param runId the run identifier.
     * @param state the full run state to persist.
     */
    void put(String runId, RunState state);

    /**
     * Reads the latest snapshot.
     *
     * @param runId the run identifier.
     * @return the stored state, or empty when no checkpoint exists (NotFound).
     */
    Optional<RunState> get(String runId);

    /**
     * Removes the checkpoint. Deleting a missing checkpoint is a no-op.
     *
     * @param runId the run identifier.
     */
    void delete(String runId);

    /**
     * Takes exclusive ownership of a suspended run so a decision can be applied to it.
     *
     * @param runId the run identifier.
     * @return the state that was checkpointed.
     * @throws UnknownRunException if no checkpoint exists and the run was never resolved.
     * @throws RunAlreadyResolvedException if the run was resolved or another caller holds the claim.
     */
    RunState claim(String runId);

    /**
     * Records that a run reached a terminal status, so late decisions can be told apart from unknown ids.
     *
     * @param runId the run identifier.
     * @param finalStatus {@link RunStatus#COMPLETED} or {@link RunStatus#ABORTED}.
     */
    void markResolved(String runId, RunStatus finalStatus);

    /**
     * Records the terminal status and then removes the checkpoint, so there is no moment at which a late
     * decision finds neither. A caller racing with this sees {@link RunAlreadyResolvedException}, never
     * {@link UnknownRunException}.
     *
     * @param runId the run identifier.
     * @param finalStatus a terminal status.
     * @throws IllegalArgumentException if {@code finalStatus} is not terminal.
     */
    void resolve(String runId, RunStatus finalStatus);

    /**
     * @param runId the run identifier.
     * @return {@code true} if {@link #markResolved(String, RunStatus)} was called for the run.
     */
    boolean isResolved(String runId);

    /**
     * Lists unclaimed checkpoints of a session, newest first.
     *
     * @param session the owning session.
     * @return suspended run states awaiting a decision.
     */
    List<RunState> findPending(SessionKey session);
}
