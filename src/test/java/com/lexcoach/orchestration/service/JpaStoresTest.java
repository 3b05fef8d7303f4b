package com.lexcoach.orchestration.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexcoach.orchestration.exception.RunAlreadyResolvedException;
import com.lexcoach.orchestration.exception.UnknownRunException;
import com.lexcoach.orchestration.model.ApprovalDecision;
import com.lexcoach.orchestration.model.ApprovalRequest;
import com.lexcoach.orchestration.model.Plan;
import com.lexcoach.orchestration.model.RunState;
import com.lexcoach.orchestration.model.RunStatus;
import com.lexcoach.orchestration.model.SessionKey;
import com.lexcoach.orchestration.model.ToolInvocation;
import com.lexcoach.orchestration.model.Turn;
import com.lexcoach.repository.BaseRepositoryTest;
import com.lexcoach.repository.ConversationTurnRepository;
import com.lexcoach.repository.ResolvedRunRepository;
import com.lexcoach.repository.RunCheckpointRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JpaStoresTest extends BaseRepositoryTest {

    @Autowired
    private RunCheckpointRepository checkpointRepository;

    @Autowired
    private ResolvedRunRepository resolvedRunRepository;

    @Autowired
    private ConversationTurnRepository turnRepository;

    private JpaCheckpointStore checkpointStore;
    private JpaMemoryStore memoryStore;
    private final SessionKey session = SessionKey.of("u1", "s1");

    @BeforeEach
    void setUp() {
        JsonProcessingService json = new JsonProcessingService(new ObjectMapper().findAndRegisterModules());
        checkpointStore = new JpaCheckpointStore(checkpointRepository, resolvedRunRepository, json);
        memoryStore = new JpaMemoryStore(turnRepository);
    }

    private RunState suspended() {
        Plan plan = new Plan(List.of(new ToolInvocation("grade_essay", Map.of("essay", "text", "words", 120),
                "grading", true)), 0.4, "grade it");
        RunState state = RunState.start(Turn.of(session, "Grade my essay")).withPlan(plan);
        return state.awaitingApproval(new ApprovalRequest(state.runId(), plan, 0.4, "low", Instant.now()));
    }

    @Test
    void testCheckpointRoundTripKeepsFullState() {
        RunState state = suspended();
        checkpointStore.put(state.runId(), state);

        RunState loaded = checkpointStore.get(state.runId()).orElseThrow();

        assertEquals(state, loaded);
        assertEquals(RunStatus.AWAITING_APPROVAL, loaded.status());
        assertEquals(120, loaded.plan().invocations().get(0).arguments().get("words"));
    }

    @Test
    void testGetAfterDeleteIsEmpty() {
        RunState state = suspended();
        checkpointStore.put(state.runId(), state);
        checkpointStore.delete(state.runId());
        checkpointStore.delete(state.runId());

        assertTrue(checkpointStore.get(state.runId()).isEmpty());
    }

    @Test
    void testClaimThenResolve() {
        RunState state = suspended();
        checkpointStore.put(state.runId(), state);

        assertEquals(state.runId(), checkpointStore.claim(state.runId()).runId());
        assertThrows(RunAlreadyResolvedException.class, () -> checkpointStore.claim(state.runId()));
        assertTrue(checkpointStore.findPending(session).isEmpty());

        checkpointStore.delete(state.runId());
        checkpointStore.markResolved(state.runId(), RunStatus.COMPLETED);

        assertTrue(checkpointStore.isResolved(state.runId()));
        assertThrows(RunAlreadyResolvedException.class, () -> checkpointStore.claim(state.runId()));
        assertThrows(UnknownRunException.class, () -> checkpointStore.claim("never-existed"));
    }

    @Test
    void testResolveWritesTombstoneAndDropsCheckpoint() {
        RunState state = suspended();
        checkpointStore.put(state.runId(), state);
        checkpointStore.claim(state.runId());

        checkpointStore.resolve(state.runId(), RunStatus.COMPLETED);

        assertTrue(checkpointStore.get(state.runId()).isEmpty());
        assertEquals("COMPLETED", resolvedRunRepository.findById(state.runId()).orElseThrow().getFinalStatus());
        assertThrows(RunAlreadyResolvedException.class, () -> checkpointStore.claim(state.runId()));
        assertThrows(IllegalArgumentException.class,
                () -> checkpointStore.resolve(state.runId(), RunStatus.AWAITING_APPROVAL));
    }

    @Test
    void testPendingListsUnclaimedRunsOfSession() {
        RunState state = suspended();
        checkpointStore.put(state.runId(), state);

        List<RunState> pending = checkpointStore.findPending(session);

        assertEquals(1, pending.size());
        assertEquals(state.approvalRequest(), pending.get(0).approvalRequest());
        assertTrue(checkpointStore.findPending(SessionKey.of("u1", "elsewhere")).isEmpty());
    }

    @Test
    void testMemoryReturnsChronologicalWindow() {
        Turn first = Turn.of(session, "one").withAnswer("1");
        Turn second = new Turn("t2", session, "two", "2", "run-2", first.timestamp().plusSeconds(5), "be brief");
        Turn third = new Turn("t3", session, "three", "3", "run-3", first.timestamp().plusSeconds(10), null);
        memoryStore.append(session, first);
        memoryStore.append(session, third);
        memoryStore.append(session, second);

        List<Turn> recent = memoryStore.recent(session, 2);

        assertEquals(List.of("two", "three"), recent.stream().map(Turn::userText).toList());
        assertEquals("be brief", recent.get(0).feedback());
        assertTrue(memoryStore.recent(session, 0).isEmpty());
    }

    @Test
    void testDecisionSurvivesSerialization() {
        RunState decided = suspended().withDecision(ApprovalDecision.modify("shorter"));
        checkpointStore.put(decided.runId(), decided);

        RunState loaded = checkpointStore.get(decided.runId()).orElseThrow();

        assertEquals("shorter", loaded.decision().feedback());
        assertEquals("shorter", loaded.turn().feedback());
    }
}
