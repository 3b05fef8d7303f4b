package com.lexcoach.api;

import com.lexcoach.orchestration.WorkflowOrchestrator;
import com.lexcoach.orchestration.exception.RunAlreadyResolvedException;
import com.lexcoach.orchestration.exception.UnknownRunException;
import com.lexcoach.orchestration.model.ApprovalDecision;
import com.lexcoach.orchestration.model.ApprovalRequest;
import com.lexcoach.orchestration.model.DecisionType;
import com.lexcoach.orchestration.model.Plan;
import com.lexcoach.orchestration.model.RunOutcome;
import com.lexcoach.orchestration.model.SessionKey;
import com.lexcoach.orchestration.model.ToolInvocation;
import com.lexcoach.orchestration.model.Turn;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatController.class)
class ChatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WorkflowOrchestrator orchestrator;

    private ApprovalRequest approvalRequest(String runId) {
        Plan plan = new Plan(List.of(new ToolInvocation("grade_essay", Map.of("essay", "text"), "grading", false)),
                0.4, "grade it");
        return new ApprovalRequest(runId, plan, 0.4, "Human approval needed: very low confidence (confidence: 0.40)",
                Instant.parse("2026-01-01T10:00:00Z"));
    }

    @Test
    void testChatCompletes() throws Exception {
        when(orchestrator.start(any())).thenReturn(new RunOutcome.Completed("run-1", "Paris.", Plan.noTools("direct"), List.of()));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"u1\", \"message\": \"  capital of France  \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.runId").value("run-1"))
                .andExpect(jsonPath("$.answer").value("Paris."))
                .andExpect(jsonPath("$.approval").doesNotExist());

        ArgumentCaptor<Turn> turn = ArgumentCaptor.forClass(Turn.class);
        verify(orchestrator).start(turn.capture());
        assertEquals("capital of France", turn.getValue().userText());
        assertEquals(SessionKey.of("u1", "default"), turn.getValue().session());
    }

    @Test
    void testChatSuspendsForApproval() throws Exception {
        when(orchestrator.start(any())).thenReturn(new RunOutcome.PendingApproval(approvalRequest("run-2")));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"u1\", \"sessionId\": \"s1\", \"message\": \"grade my essay\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING_APPROVAL"))
                .andExpect(jsonPath("$.approval.confidence").value(0.4))
                .andExpect(jsonPath("$.approval.plannedTools[0].toolName").value("grade_essay"))
                .andExpect(jsonPath("$.answer").doesNotExist());
    }

    @Test
    void testChatReportsFailure() throws Exception {
        when(orchestrator.start(any())).thenReturn(new RunOutcome.Failed("run-3", "provider down", "Sorry.", true));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"u1\", \"message\": \"hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.retryable").value(true))
                .andExpect(jsonPath("$.answer").value("Sorry."));
    }

    @Test
    void testBlankMessageIsRejected() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"u1\", \"message\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Invalid request"));
        verifyNoInteractions(orchestrator);
    }

    @Test
    void testDecisionWithRunId() throws Exception {
        when(orchestrator.resume(eq("run-2"), any()))
                .thenReturn(new RunOutcome.Completed("run-2", "Graded.", Plan.noTools("x"), List.of()));

        mockMvc.perform(post("/api/chat/decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"u1\", \"runId\": \"run-2\", \"decision\": \"APPROVE\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Graded."));

        verify(orchestrator).resume("run-2", ApprovalDecision.approve());
    }

    @Test
    void testDecisionWithoutRunIdUsesLatestPendingRun() throws Exception {
        when(orchestrator.resumeLatest(any(), any()))
                .thenReturn(new RunOutcome.Completed("run-4", "Skipped.", Plan.noTools("x"), List.of()));

        mockMvc.perform(post("/api/chat/decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"u1\", \"sessionId\": \"s1\", \"decision\": \"REJECT\", \"feedback\": \"no\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-4"));

        verify(orchestrator).resumeLatest(SessionKey.of("u1", "s1"), new ApprovalDecision(DecisionType.REJECT, "no"));
    }

    @Test
    void testUnknownRunIsNotFound() throws Exception {
        when(orchestrator.resume(eq("nope"), any())).thenThrow(new UnknownRunException("nope"));

        mockMvc.perform(post("/api/chat/decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"u1\", \"runId\": \"nope\", \"decision\": \"APPROVE\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.runId").value("nope"));
    }

    @Test
    void testResolvedRunIsConflict() throws Exception {
        when(orchestrator.resume(eq("done"), any())).thenThrow(new RunAlreadyResolvedException("done"));

        mockMvc.perform(post("/api/chat/decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"u1\", \"runId\": \"done\", \"decision\": \"APPROVE\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title").value("Run already resolved"));
    }

    @Test
    void testMissingDecisionIsRejected() throws Exception {
        mockMvc.perform(post("/api/chat/decision")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"u1\", \"runId\": \"run-2\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testCancel() throws Exception {
        when(orchestrator.cancel("run-2")).thenReturn(true);

        mockMvc.perform(post("/api/chat/cancel/{runId}", "run-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));
        mockMvc.perform(post("/api/chat/cancel/{runId}", "other"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("not-found"));
    }

    @Test
    void testPendingApprovals() throws Exception {
        when(orchestrator.findPending(SessionKey.of("u1", "s1"))).thenReturn(List.of(approvalRequest("run-5")));

        mockMvc.perform(get("/api/chat/pending").param("userId", "u1").param("sessionId", "s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].runId").value("run-5"))
                .andExpect(jsonPath("$[0].reason").value("Human approval needed: very low confidence (confidence: 0.40)"));
    }

    @Test
    void testHistory() throws Exception {
        SessionKey session = SessionKey.of("u1", "default");
        when(orchestrator.history(session, 5)).thenReturn(List.of(Turn.of(session, "What is a tort?").withAnswer("A civil wrong.")));

        mockMvc.perform(get("/api/chat/history").param("userId", "u1").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].human").value("What is a tort?"))
                .andExpect(jsonPath("$[0].ai").value("A civil wrong."));
    }

    @Test
    void testHistoryRequiresUser() throws Exception {
        mockMvc.perform(get("/api/chat/history"))
                .andExpect(status().isBadRequest());
    }
}
