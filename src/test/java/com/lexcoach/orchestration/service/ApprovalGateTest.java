package com.lexcoach.orchestration.service;

import com.lexcoach.config.CoachProperties;
import com.lexcoach.orchestration.model.ApprovalRequest;
import com.lexcoach.orchestration.model.Plan;
import com.lexcoach.orchestration.model.SessionKey;
import com.lexcoach.orchestration.model.ToolInvocation;
import com.lexcoach.orchestration.model.Turn;
import com.lexcoach.tools.StubTool;
import com.lexcoach.tools.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalGateTest {

    private final CoachProperties properties = new CoachProperties();
    private final Turn turn = Turn.of(SessionKey.of("u1", null), "quiz me");
    private ApprovalGate gate;

    @BeforeEach
    void setUp() {
        ToolRegistry registry = new ToolRegistry(List.of(
                StubTool.returning("get_practice_question", "{}"),
                StubTool.returning("grade_essay", "{}").markSensitive()), properties.getTools());
        gate = new ApprovalGate(registry, new ConfidenceAssessor(), properties);
    }

    private Plan plan(double confidence, String... tools) {
        List<ToolInvocation> invocations = java.util.Arrays.stream(tools)
                .map(tool -> new ToolInvocation(tool, Map.of(), null, false))
                .toList();
        return new Plan(invocations, confidence, "reasoning");
    }

    @Test
    void testConfidentPlanPassesThrough() {
        assertTrue(gate.evaluate("run-1", turn, plan(0.9, "get_practice_question")).isEmpty());
    }

    @Test
    void testConfidenceExactlyAtThresholdPasses() {
        assertTrue(gate.evaluate("run-1", turn, plan(0.7, "get_practice_question")).isEmpty());
    }

    @Test
    void testLowConfidenceSuspends() {
        Optional<ApprovalRequest> request = gate.evaluate("run-1", turn, plan(0.55, "get_practice_question"));

        assertTrue(request.isPresent());
        assertEquals("run-1", request.get().runId());
        assertEquals(0.55, request.get().confidence(), 1e-9);
        assertEquals("Human approval needed: low confidence (confidence: 0.55)", request.get().reason());
    }

    @Test
    void testSensitiveToolSuspendsEvenWhenConfident() {
        Optional<ApprovalRequest> request = gate.evaluate("run-2", turn, plan(0.99, "grade_essay"));

        assertTrue(request.isPresent());
        assertTrue(request.get().reason().contains("sensitive tool requested: grade_essay"));
    }

    @Test
    void testPlanWithoutToolsIsNeverGated() {
        properties.getApproval().setThreshold(1.0);
        assertTrue(gate.evaluate("run-3", turn, new Plan(List.of(), 0.0, "nothing to do")).isEmpty());
    }

    @Test
    void testDisabledGateNeverSuspends() {
        properties.getApproval().setEnabled(false);
        assertTrue(gate.evaluate("run-4", turn, plan(0.1, "grade_essay")).isEmpty());
    }
}
