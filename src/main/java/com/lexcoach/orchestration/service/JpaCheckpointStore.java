package com.lexcoach.orchestration.service;

import com.lexcoach.entity.ResolvedRun;
import com.lexcoach.entity.RunCheckpoint;
import com.lexcoach.orchestration.api.CheckpointStore;
import com.lexcoach.orchestration.exception.RunAlreadyResolvedException;
import com.lexcoach.orchestration.exception.UnknownRunException;
import com.lexcoach.orchestration.model.RunState;
import com.lexcoach.orchestration.model.RunStatus;
import com.lexcoach.orchestration.model.SessionKey;
import com.lexcoach.repository.ResolvedRunRepository;
import com.lexcoach.repository.RunCheckpointRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Checkpoint store backed by the {@code run_checkpoint} table. The claim is a conditional update, so only one
 * of several concurrent resumes, across processes, can win it.
 */
@Slf4j
public class JpaCheckpointStore implements CheckpointStore {

    private final RunCheckpointRepository checkpointRepository;
    private final ResolvedRunRepository resolvedRunRepository;
    private final JsonProcessingService jsonProcessingService;

    public JpaCheckpointStore(RunCheckpointRepository checkpointRepository,
                              ResolvedRunRepository resolvedRunRepository,
                              JsonProcessingService jsonProcessingService) {
        this.checkpointRepository = checkpointRepository;
        this.resolvedRunRepository = resolvedRunRepository;
        this.jsonProcessingService = jsonProcessingService;
    }

    @Override
    @Transactional
    public void put(String runId, RunState state) {
        SessionKey session = state.turn().session();
        RunCheckpoint checkpoint = checkpointRepository.findById(runId)
                .orElseGet(() -> RunCheckpoint.builder()
                        .runId(runId)
                        .userId(session.userId())
                        .sessionId(session.sessionId())
                        .build());
        checkpoint.setStatus(state.status().name());
        checkpoint.setStateJson(jsonProcessingService.toCompactJson(state));
        checkpointRepository.save(checkpoint);
        log.debug("Checkpoint stored for run {} with status {}.", runId, state.status());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RunState> get(String runId) {
        return checkpointRepository.findById(runId).map(this::toState);
    }

    @Override
    @Transactional
    public void delete(String runId) {
        if (checkpointRepository.existsById(runId)) {
            checkpointRepository.deleteById(runId);
            log.debug("Checkpoint deleted for run {}.", runId);
        }
    }

    @Override
    @Transactional
    public RunState claim(String runId) {
        if (checkpointRepository.claim(runId) == 1) {
            return checkpointRepository.findById(runId)
                    .map(this::toState)
                    .orElseThrow(() -> new UnknownRunException(runId));
        }
        if (checkpointRepository.existsById(runId) || resolvedRunRepository.existsById(runId)) {
            throw new RunAlreadyResolvedException(runId);
        }
        throw new UnknownRunException(runId);
    }

    @Override
    @Transactional
    public void markResolved(String runId, RunStatus finalStatus) {
        resolvedRunRepository.save(ResolvedRun.builder()
                .runId(runId)
                .finalStatus(finalStatus.name())
                .build());
    }

    @Override
    @Transactional
    public void resolve(String runId, RunStatus finalStatus) {
        if (!finalStatus.isTerminal()) {
            throw new IllegalArgumentException("Run " + runId + " cannot be resolved as " + finalStatus);
        }
        resolvedRunRepository.saveAndFlush(ResolvedRun.builder()
                .runId(runId)
                .finalStatus(finalStatus.name())
                .build());
        checkpointRepository.deleteById(runId);
        log.debug("Run {} resolved as {}.", runId, finalStatus);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isResolved(String runId) {
        return resolvedRunRepository.existsById(runId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RunState> findPending(SessionKey session) {
        return checkpointRepository
                .findByUserIdAndSessionIdAndClaimedFalseOrderByCreatedAtDesc(session.userId(), session.sessionId())
                .stream()
                .map(this::toState)
                .toList();
    }

    private RunState toState(RunCheckpoint checkpoint) {
        return jsonProcessingService.fromJson(checkpoint.getStateJson(), RunState.class);
    }
}
