package com.lexcoach.orchestration.service;

import com.lexcoach.orchestration.model.Plan;
import com.lexcoach.orchestration.model.ToolInvocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.lexcoach.orchestration.OrchestrationConstants.*;

/**
 * Rule-based plan used when the model reply cannot be parsed. Confidence is left at the heuristic baseline so
 * the approval gate still sees a fallback plan as less certain than a parsed one.
 */
@Component
@Slf4j
public class KeywordFallbackPlanner {

    static final double FALLBACK_CONFIDENCE = 0.6;

    public Plan plan(String userText) {
        log.info("Using keyword fallback planning.");
        String text = userText == null ? "" : userText.toLowerCase(Locale.ROOT);
        if (containsAny(text, "practice", "question", "start")) {
            return single(TOOL_PRACTICE_QUESTION, Map.of("topic", "Grammar", "difficulty", "medium"),
                    "Fallback: detected practice-related request", "User wants practice questions");
        }
        if (containsAny(text, "progress", "performance")) {
            return single(TOOL_LEARNING_PROGRESS, Map.of(),
                    "Fallback: detected progress request", "User wants to see progress");
        }
        if (containsAny(text, "grammar", "english", "vocabulary")) {
            return single(TOOL_DOCUMENT_SEARCH, Map.of("query", userText, "max_results", 5),
                    "Fallback: detected English learning request", "User needs English learning content");
        }
        return Plan.noTools("Fallback: general question, no tools needed");
    }

    private Plan single(String tool, Map<String, Object> arguments, String reasoning, String rationale) {
        return new Plan(List.of(new ToolInvocation(tool, arguments, rationale, false)), FALLBACK_CONFIDENCE, reasoning);
    }

    private boolean containsAny(String text, String... words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
