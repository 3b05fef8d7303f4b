package com.lexcoach.orchestration.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexcoach.orchestration.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Appends practice questions and progress summaries found in successful tool payloads to the model answer,
 * so they reach the student verbatim even when the model paraphrases them.
 */
@Component
public class StructuredResultFormatter {

    static final int MAX_PROGRESS_TOPICS = 5;

    public String enhance(String answer, List<ToolResult> results) {
        StringBuilder sb = new StringBuilder(answer);
        for (ToolResult result : results) {
            if (!result.success() || result.payload() == null || !result.payload().isObject()) {
                continue;
            }
            JsonNode payload = result.payload();
            if (!payload.path("success").asBoolean(false)) {
                continue;
            }
            if (payload.path("question").isObject()) {
                appendQuestion(sb, payload.get("question"));
            } else if (payload.path("analytics").path("topics").isArray()) {
                appendProgress(sb, payload.get("analytics").get("topics"));
            }
        }
        return sb.toString();
    }

    private void appendQuestion(StringBuilder sb, JsonNode question) {
        sb.append("\n\n**Practice Question:**\n")
                .append("**Topic:** ").append(question.path("topic").asText("General")).append("\n")
                .append("**Difficulty:** ").append(question.path("difficulty").asText("Medium")).append("\n\n")
                .append(question.path("text").asText("")).append("\n\n")
                .append("**Options:**\n");
        JsonNode options = question.path("options");
        if (options.isArray()) {
            options.forEach(option -> sb.append(option.asText()).append("\n"));
        } else if (options.isObject()) {
            options.fields().forEachRemaining(option ->
                    sb.append(option.getKey()).append(") ").append(option.getValue().asText()).append("\n"));
        } else {
            sb.append(options.asText("")).append("\n");
        }
        sb.append("\nPlease provide your answer (A, B, C, or D).");
    }

    private void appendProgress(StringBuilder sb, JsonNode topics) {
        sb.append("\n\n**Your Learning Progress:**\n");
        int shown = 0;
        for (JsonNode topic : topics) {
            if (shown++ >= MAX_PROGRESS_TOPICS) {
                break;
            }
            sb.append(statusMarker(topic.path("status").asText("")))
                    .append(" **").append(topic.path("topic").asText("Unknown")).append("**: ")
                    .append(String.format(Locale.ROOT, "%.1f", topic.path("accuracy").asDouble(0.0)))
                    .append("% (").append(topic.path("total_questions").asInt(0)).append(" questions)\n");
        }
    }

    private String statusMarker(String status) {
        return switch (status) {
            case "excellent" -> "[excellent]";
            case "good" -> "[good]";
            default -> "[needs work]";
        };
    }
}
