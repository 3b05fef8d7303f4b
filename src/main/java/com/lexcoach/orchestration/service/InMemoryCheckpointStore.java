package com.lexcoach.orchestration.service;

import com.lexcoach.orchestration.api.CheckpointStore;
import com.lexcoach.orchestration.exception.RunAlreadyResolvedException;
import com.lexcoach.orchestration.exception.UnknownRunException;
import com.lexcoach.orchestration.model.RunState;
import com.lexcoach.orchestration.model.RunStatus;
import com.lexcoach.orchestration.model.SessionKey;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local checkpoint store. Suspended runs do not survive a restart; use the JPA store for that.
 * Claim, delete and resolve share the instance lock, so a claim never observes a half-resolved run.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, RunState> checkpoints = new ConcurrentHashMap<>();
    private final Set<String> claimed = ConcurrentHashMap.newKeySet();
    private final Map<String, RunStatus> resolved = new ConcurrentHashMap<>();

    @Override
    public void put(String runId, RunState state) {
        checkpoints.put(runId, state);
    }

    @Override
    public Optional<RunState> get(String runId) {
        return Optional.ofNullable(checkpoints.get(runId));
    }

    @Override
    public synchronized void delete(String runId) {
        checkpoints.remove(runId);
        claimed.remove(runId);
    }

    @Override
    public synchronized RunState claim(String runId) {
        RunState state = checkpoints.get(runId);
        if (state == null) {
            if (resolved.containsKey(runId)) {
                throw new RunAlreadyResolvedException(runId);
            }
            throw new UnknownRunException(runId);
        }
        if (!claimed.add(runId)) {
            throw new RunAlreadyResolvedException(runId);
        }
        return state;
    }

    @Override
    public void markResolved(String runId, RunStatus finalStatus) {
        resolved.put(runId, finalStatus);
    }

    @Override
    public synchronized void resolve(String runId, RunStatus finalStatus) {
        if (!finalStatus.isTerminal()) {
            throw new IllegalArgumentException("Run " + runId + " cannot be resolved as " + finalStatus);
        }
        markResolved(runId, finalStatus);
        delete(runId);
    }

    @Override
    public boolean isResolved(String runId) {
        return resolved.containsKey(runId);
    }

    @Override
    public List<RunState> findPending(SessionKey session) {
        return checkpoints.values().stream()
                .filter(state -> session.equals(state.turn().session()))
                .filter(state -> !claimed.contains(state.runId()))
                .sorted(Comparator.comparing(RunState::updatedAt).reversed())
                .toList();
    }
}
