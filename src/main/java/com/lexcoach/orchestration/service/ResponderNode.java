package com.lexcoach.orchestration.service;

import static com.lexcoach.orchestration.OrchestrationConstants.*;

import com.lexcoach.config.CoachProperties;
import com.lexcoach.orchestration.api.LanguageModelClient;
import com.lexcoach.orchestration.exception.LanguageModelException;
import com.lexcoach.orchestration.exception.ResponderFailureException;
import com.lexcoach.orchestration.model.ApprovalDecision;
import com.lexcoach.orchestration.model.DecisionType;
import com.lexcoach.orchestration.model.Plan;
import com.lexcoach.orchestration.model.RunState;
import com.lexcoach.orchestration.model.ToolInvocation;
import com.lexcoach.orchestration.model.ToolResult;
import com.lexcoach.orchestration.model.Turn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;

@Service
@Slf4j
public class ResponderNode {

    private final LanguageModelClient languageModel;
    private final JsonProcessingService jsonProcessingService;
    private final StructuredResultFormatter resultFormatter;
    private final CoachProperties properties;

    public ResponderNode(LanguageModelClient languageModel,
                         JsonProcessingService jsonProcessingService,
                         StructuredResultFormatter resultFormatter,
                         CoachProperties properties) {
        this.languageModel = languageModel;
        this.jsonProcessingService = jsonProcessingService;
        this.resultFormatter = resultFormatter;
        this.properties = properties;
    }

    /**
     * Produces the final answer of a run. Always returns a non-empty text.
     */
    public String respond(RunState state, List<Turn> memory) {
        boolean declined = isDeclined(state.decision());
        try {
            String answer = generate(state, memory, declined);
            String enhanced = declined ? answer : resultFormatter.enhance(answer, state.toolResults());
            log.info("RESPONDER: generated response for run {}: {}", state.runId(), jsonProcessingService.truncate(enhanced, 100));
            return enhanced;
        } catch (ResponderFailureException ex) {
            log.error("RESPONDER: error generating response for run {}: {}", state.runId(), ex.getMessage());
            return declined ? REJECTED_FALLBACK_MESSAGE : properties.getCannedApology();
        }
    }

    private String generate(RunState state, List<Turn> memory, boolean declined) {
        String instruction;
        if (declined) {
            instruction = RESPONDER_REJECTED_PROMPT;
        } else if (!state.toolResults().isEmpty()) {
            instruction = RESPONDER_TOOLS_PROMPT;
        } else {
            instruction = RESPONDER_DIRECT_PROMPT;
        }
        String answer;
        try {
            answer = languageModel.complete(PURPOSE_RESPOND, instruction, buildContext(state, memory));
        } catch (LanguageModelException ex) {
            throw new ResponderFailureException("Language model failed: " + ex.getMessage(), ex);
        }
        if (!StringUtils.hasText(answer)) {
            throw new ResponderFailureException("Language model returned an empty answer");
        }
        return answer.trim();
    }

    String buildContext(RunState state, List<Turn> memory) {
        StringBuilder sb = new StringBuilder();
        if (memory != null && !memory.isEmpty()) {
            sb.append("Recent conversation:\n");
            for (Turn prior : memory) {
                sb.append("User: ").append(jsonProcessingService.truncate(prior.userText(), MAX_MEMORY_CHARS)).append("\n");
                if (StringUtils.hasText(prior.answer())) {
                    sb.append("Assistant: ").append(jsonProcessingService.truncate(prior.answer(), MAX_MEMORY_CHARS)).append("\n");
                }
            }
            sb.append("\n");
        }
        sb.append("User message: ").append(state.turn().userText()).append("\n");

        Plan plan = state.plan();
        if (plan != null) {
            sb.append("\nPlanning reasoning: ").append(plan.reasoning()).append("\n");
            if (!plan.isEmpty()) {
                sb.append("Planned actions:\n");
                for (ToolInvocation invocation : plan.invocations()) {
                    sb.append("- ").append(invocation.toolName());
                    if (StringUtils.hasText(invocation.rationale())) {
                        sb.append(": ").append(invocation.rationale());
                    }
                    sb.append("\n");
                }
            }
        }

        ApprovalDecision decision = state.decision();
        if (isDeclined(decision)) {
            sb.append("\nReviewer decision: ").append(decision.type().name().toLowerCase(Locale.ROOT)).append("\n");
            if (StringUtils.hasText(decision.feedback())) {
                sb.append("Reviewer feedback: ").append(decision.feedback()).append("\n");
            }
            return sb.toString();
        }

        if (!state.toolResults().isEmpty()) {
            sb.append("\nTool results:\n");
            for (ToolResult result : state.toolResults()) {
                if (result.success()) {
                    String payload = result.payload() == null || result.payload().isTextual()
                            ? (result.payload() == null ? "" : result.payload().asText())
                            : jsonProcessingService.toCompactJson(result.payload());
                    sb.append("Tool ").append(result.toolName()).append(" result: ")
                            .append(jsonProcessingService.truncate(payload, MAX_RESULT_CHARS)).append("\n");
                } else {
                    sb.append("Tool ").append(result.toolName()).append(" failed (")
                            .append(result.failure().kind()).append("): ")
                            .append(jsonProcessingService.truncate(result.failure().message(), MAX_RESULT_CHARS)).append("\n");
                }
            }
        }
        return sb.toString();
    }

    private boolean isDeclined(ApprovalDecision decision) {
        return decision != null && decision.type() != DecisionType.APPROVE;
    }
}
