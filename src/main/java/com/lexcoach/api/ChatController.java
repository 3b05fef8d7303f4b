package com.lexcoach.api;

import com.lexcoach.orchestration.WorkflowOrchestrator;
import com.lexcoach.orchestration.model.ApprovalDecision;
import com.lexcoach.orchestration.model.RunOutcome;
import com.lexcoach.orchestration.model.SessionKey;
import com.lexcoach.orchestration.model.Turn;
import jakarta.validation.Valid;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final WorkflowOrchestrator orchestrator;

    public ChatController(WorkflowOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ChatResponse chat(@Valid @RequestBody ChatRequest request) {
        SessionKey session = SessionKey.of(request.userId(), request.sessionId());
        RunOutcome outcome = orchestrator.start(Turn.of(session, request.message().trim()));
        return ChatResponse.from(outcome);
    }

    @PostMapping("/decision")
    public ChatResponse decide(@Valid @RequestBody DecisionRequest request) {
        ApprovalDecision decision = new ApprovalDecision(request.decision(), request.feedback());
        RunOutcome outcome = StringUtils.hasText(request.runId())
                ? orchestrator.resume(request.runId().trim(), decision)
                : orchestrator.resumeLatest(SessionKey.of(request.userId(), request.sessionId()), decision);
        return ChatResponse.from(outcome);
    }

    @PostMapping("/cancel/{runId}")
    public CancelRunResponse cancel(@PathVariable String runId) {
        return orchestrator.cancel(runId) ? CancelRunResponse.success() : CancelRunResponse.notFound();
    }

    @GetMapping("/pending")
    public List<PendingApprovalResponse> pending(@RequestParam String userId,
                                                 @RequestParam(required = false) String sessionId) {
        return orchestrator.findPending(SessionKey.of(userId, sessionId)).stream()
                .map(PendingApprovalResponse::from)
                .toList();
    }

    @GetMapping("/history")
    public List<HistoryEntry> history(@RequestParam String userId,
                                      @RequestParam(required = false) String sessionId,
                                      @RequestParam(defaultValue = "20") int limit) {
        return orchestrator.history(SessionKey.of(userId, sessionId), limit).stream()
                .map(HistoryEntry::from)
                .toList();
    }
}
