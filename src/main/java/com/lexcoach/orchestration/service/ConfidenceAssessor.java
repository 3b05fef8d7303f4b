package com.lexcoach.orchestration.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyword heuristics for plans whose model reply carries no confidence, and for the reasons shown to reviewers.
 */
@Component
@Slf4j
public class ConfidenceAssessor {

    static final double BASELINE = 0.8;

    static final List<String> AUTO_APPROVE_KEYWORDS = List.of(
            "practice", "question", "progress", "simple", "basic", "help", "show");

    static final List<String> COMPLEX_KEYWORDS = List.of(
            "analyze", "complex", "detailed", "comprehensive", "intricate",
            "elaborate", "sophisticated", "nuanced", "multifaceted", "explain");

    static final List<String> AMBIGUOUS_KEYWORDS = List.of(
            "something", "anything", "whatever", "i don't know", "not sure", "maybe");

    public double assess(String userText, int invocationCount) {
        String text = userText == null ? "" : userText.toLowerCase(Locale.ROOT);
        double confidence = BASELINE;
        if (containsAny(text, AUTO_APPROVE_KEYWORDS)) {
            confidence += 0.1;
        }
        boolean complex = containsAny(text, COMPLEX_KEYWORDS);
        if (complex) {
            confidence -= 0.3;
        }
        if (containsAny(text, AMBIGUOUS_KEYWORDS)) {
            confidence -= 0.4;
        }
        if (text.length() > 200) {
            confidence -= 0.2;
        } else if (text.length() < 20) {
            confidence += 0.1;
        }
        if (invocationCount == 0 && complex) {
            confidence -= 0.2;
        }
        double bounded = Math.max(0.0, Math.min(1.0, confidence));
        log.debug("Assessed confidence {} for request of {} chars.", String.format(Locale.ROOT, "%.2f", bounded), text.length());
        return bounded;
    }

    public String approvalReason(double confidence, String userText, List<String> sensitiveTools) {
        String text = userText == null ? "" : userText.toLowerCase(Locale.ROOT);
        List<String> reasons = new ArrayList<>();
        if (confidence < 0.5) {
            reasons.add("very low confidence");
        } else if (confidence < 0.7) {
            reasons.add("low confidence");
        }
        if (!sensitiveTools.isEmpty()) {
            reasons.add("sensitive tool requested: " + String.join(", ", sensitiveTools));
        }
        if (text.length() > 200) {
            reasons.add("complex question");
        }
        if (containsAny(text, COMPLEX_KEYWORDS)) {
            reasons.add("complex analysis requested");
        }
        if (containsAny(text, AMBIGUOUS_KEYWORDS)) {
            reasons.add("ambiguous request");
        }
        String reasonText = reasons.isEmpty() ? "requires review" : String.join(", ", reasons);
        return String.format(Locale.ROOT, "Human approval needed: %s (confidence: %.2f)", reasonText, confidence);
    }

    private boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
