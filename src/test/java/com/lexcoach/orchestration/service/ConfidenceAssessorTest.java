package com.lexcoach.orchestration.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceAssessorTest {

    private final ConfidenceAssessor assessor = new ConfidenceAssessor();

    @Test
    void testSimpleShortRequestIsConfident() {
        assertEquals(1.0, assessor.assess("show progress", 1), 1e-9);
    }

    @Test
    void testComplexRequestLosesConfidence() {
        // 0.8 - 0.3 (complex) for a 30+ character message
        assertEquals(0.5, assessor.assess("Please analyze my mock test results", 1), 1e-9);
    }

    @Test
    void testComplexRequestWithoutToolsLosesMore() {
        assertEquals(0.3, assessor.assess("Please analyze my mock test results", 0), 1e-9);
    }

    @Test
    void testAmbiguousLongRequestBottomsOut() {
        String text = "I'm not sure, maybe something about the constitution " + "and more ".repeat(20);
        assertTrue(text.length() > 200);
        // 0.8 - 0.4 (ambiguous) - 0.2 (long)
        assertEquals(0.2, assessor.assess(text, 1), 1e-9);
    }

    @Test
    void testApprovalReasonListsEveryTrigger() {
        String reason = assessor.approvalReason(0.3, "Explain whatever you think", List.of("grade_essay"));

        assertEquals("Human approval needed: very low confidence, sensitive tool requested: grade_essay, "
                + "complex analysis requested, ambiguous request (confidence: 0.30)", reason);
    }

    @Test
    void testApprovalReasonDefault() {
        assertEquals("Human approval needed: requires review (confidence: 0.90)",
                assessor.approvalReason(0.9, "hi", List.of()));
    }
}
