package com.lexcoach.orchestration.service;

import com.lexcoach.orchestration.model.Plan;
import org.junit.jupiter.api.Test;

import static com.lexcoach.orchestration.OrchestrationConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class KeywordFallbackPlannerTest {

    private final KeywordFallbackPlanner planner = new KeywordFallbackPlanner();

    @Test
    void testPracticeRequest() {
        Plan plan = planner.plan("Let's start some practice");
        assertEquals(TOOL_PRACTICE_QUESTION, plan.invocations().get(0).toolName());
        assertEquals("Grammar", plan.invocations().get(0).arguments().get("topic"));
        assertEquals(KeywordFallbackPlanner.FALLBACK_CONFIDENCE, plan.confidence(), 1e-9);
    }

    @Test
    void testProgressRequest() {
        assertEquals(TOOL_LEARNING_PROGRESS, planner.plan("How is my PROGRESS?").invocations().get(0).toolName());
    }

    @Test
    void testEnglishRequestSearchesDocuments() {
        Plan plan = planner.plan("vocabulary for reading comprehension");
        assertEquals(TOOL_DOCUMENT_SEARCH, plan.invocations().get(0).toolName());
        assertEquals("vocabulary for reading comprehension", plan.invocations().get(0).arguments().get("query"));
    }

    @Test
    void testOtherRequestsNeedNoTools() {
        Plan plan = planner.plan("Good morning");
        assertTrue(plan.isEmpty());
        assertEquals(1.0, plan.confidence(), 1e-9);
    }
}
