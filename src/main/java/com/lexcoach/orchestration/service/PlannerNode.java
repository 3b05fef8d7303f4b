package com.lexcoach.orchestration.service;

import static com.lexcoach.orchestration.OrchestrationConstants.*;

import com.lexcoach.config.CoachProperties;
import com.lexcoach.orchestration.api.LanguageModelClient;
import com.lexcoach.orchestration.exception.LanguageModelException;
import com.lexcoach.orchestration.exception.PlanningFailureException;
import com.lexcoach.orchestration.model.Plan;
import com.lexcoach.orchestration.model.ToolInvocation;
import com.lexcoach.orchestration.model.Turn;
import com.lexcoach.tools.RegisteredTool;
import com.lexcoach.tools.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Service
@Slf4j
public class PlannerNode {

    private final LanguageModelClient languageModel;
    private final ToolRegistry toolRegistry;
    private final JsonProcessingService jsonProcessingService;
    private final ConfidenceAssessor confidenceAssessor;
    private final KeywordFallbackPlanner fallbackPlanner;
    private final CoachProperties properties;

    public PlannerNode(LanguageModelClient languageModel,
                       ToolRegistry toolRegistry,
                       JsonProcessingService jsonProcessingService,
                       ConfidenceAssessor confidenceAssessor,
                       KeywordFallbackPlanner fallbackPlanner,
                       CoachProperties properties) {
        this.languageModel = languageModel;
        this.toolRegistry = toolRegistry;
        this.jsonProcessingService = jsonProcessingService;
        this.confidenceAssessor = confidenceAssessor;
        this.fallbackPlanner = fallbackPlanner;
        this.properties = properties;
    }

    /**
     * Produces a sanitized plan for the turn.
     *
     * @throws PlanningFailureException when the language model cannot be reached
     */
    public Plan plan(Turn turn, List<Turn> memory) {
        log.info("PLANNER: planning for session {}: {}", turn.session(), jsonProcessingService.truncate(turn.userText(), 100));
        String instruction = PLANNER_SYSTEM_PROMPT.formatted(toolRegistry.describe());
        String context = PLANNER_USER_TEMPLATE.formatted(renderMemory(memory), turn.userText());
        PlannerReply reply;
        try {
            String response = languageModel.complete(PURPOSE_PLAN, instruction, context);
            reply = jsonProcessingService.parseJsonResponse(PURPOSE_PLAN, response, PlannerReply.class);
            if (reply == null) {
                String retryResponse = languageModel.complete(PURPOSE_PLAN_RETRY, instruction + INVALID_JSON_RETRY_PROMPT, context);
                reply = jsonProcessingService.parseJsonResponse(PURPOSE_PLAN_RETRY, retryResponse, PlannerReply.class);
            }
        } catch (LanguageModelException ex) {
            log.error("PLANNER: language model failed: {}", ex.getMessage());
            throw new PlanningFailureException("Planning failed: " + ex.getMessage(), ex);
        }

        Plan plan;
        if (reply != null) {
            plan = sanitize(turn, requestedInvocations(reply), reply.confidence(), reply.reasoning());
        } else if (properties.getPlanner().isKeywordFallback()) {
            Plan fallback = fallbackPlanner.plan(turn.userText());
            plan = sanitize(turn, fallback.invocations(), fallback.confidence(), fallback.reasoning());
        } else {
            plan = Plan.noTools("Planner reply could not be parsed; answering directly.");
        }
        log.info("PLANNER: {} invocation(s), confidence={}, reasoning={}", plan.invocations().size(),
                plan.confidence(), jsonProcessingService.truncate(plan.reasoning(), 200));
        return plan;
    }

    private List<ToolInvocation> requestedInvocations(PlannerReply reply) {
        if (Boolean.FALSE.equals(reply.needsTools()) || reply.toolsToUse() == null) {
            return List.of();
        }
        List<ToolInvocation> requested = new ArrayList<>(reply.toolsToUse().size());
        for (PlannerReply.PlannedTool tool : reply.toolsToUse()) {
            if (tool == null) {
                continue;
            }
            requested.add(new ToolInvocation(tool.toolName(), tool.parameters(), tool.reason(), false));
        }
        return requested;
    }

    Plan sanitize(Turn turn, List<ToolInvocation> requested, @Nullable Double confidence, @Nullable String reasoning) {
        String normalizedReasoning = StringUtils.hasText(reasoning) ? reasoning.trim() : NO_REASONING;
        int maxInvocations = Math.max(1, properties.getPlanner().getMaxInvocations());
        List<ToolInvocation> accepted = new ArrayList<>();
        for (ToolInvocation invocation : requested) {
            Optional<RegisteredTool> registered = toolRegistry.find(invocation.toolName());
            if (registered.isEmpty()) {
                log.warn("PLANNER: dropping invocation of unknown tool '{}'.", invocation.toolName());
                continue;
            }
            if (accepted.size() >= maxInvocations) {
                log.warn("PLANNER: dropping invocation of '{}' beyond the limit of {}.", invocation.toolName(), maxInvocations);
                continue;
            }
            RegisteredTool tool = registered.get();
            Map<String, Object> arguments = new LinkedHashMap<>(invocation.arguments());
            if (arguments.values().removeIf(Objects::isNull)) {
                log.debug("PLANNER: dropped null-valued arguments of '{}'.", tool.name());
            }
            if (tool.declaresArgument(ARG_USER_ID) && !arguments.containsKey(ARG_USER_ID)) {
                arguments.put(ARG_USER_ID, turn.session().userId());
            }
            accepted.add(new ToolInvocation(tool.name(), arguments, invocation.rationale(), tool.strictValidation()));
        }
        if (accepted.isEmpty()) {
            return Plan.noTools(normalizedReasoning);
        }
        double resolved = confidence != null && !confidence.isNaN()
                ? confidence
                : confidenceAssessor.assess(turn.userText(), accepted.size());
        return new Plan(accepted, resolved, normalizedReasoning);
    }

    private String renderMemory(List<Turn> memory) {
        if (memory == null || memory.isEmpty()) {
            return "(no earlier turns)";
        }
        StringBuilder sb = new StringBuilder();
        for (Turn prior : memory) {
            sb.append("User: ").append(jsonProcessingService.truncate(prior.userText(), MAX_MEMORY_CHARS)).append("\n");
            if (StringUtils.hasText(prior.answer())) {
                sb.append("Assistant: ").append(jsonProcessingService.truncate(prior.answer(), MAX_MEMORY_CHARS)).append("\n");
            }
            if (StringUtils.hasText(prior.feedback())) {
                sb.append("Reviewer feedback: ").append(prior.feedback()).append("\n");
            }
        }
        return sb.toString().trim();
    }
}
