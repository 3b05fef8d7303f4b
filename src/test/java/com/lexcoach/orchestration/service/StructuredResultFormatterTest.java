package com.lexcoach.orchestration.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.lexcoach.orchestration.model.FailureKind;
import com.lexcoach.orchestration.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructuredResultFormatterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StructuredResultFormatter formatter = new StructuredResultFormatter();

    @Test
    void testProgressTopicsAreListedUpToFive() throws Exception {
        StringBuilder topics = new StringBuilder();
        for (int i = 0; i < 7; i++) {
            if (i > 0) {
                topics.append(',');
            }
            topics.append("{\"topic\": \"T").append(i).append("\", \"status\": \"")
                    .append(i == 0 ? "excellent" : "weak")
                    .append("\", \"accuracy\": 72.25, \"total_questions\": 8}");
        }
        ToolResult result = ToolResult.success(0, "get_learning_progress",
                objectMapper.readTree("{\"success\": true, \"analytics\": {\"topics\": [" + topics + "]}}"));

        String enhanced = formatter.enhance("Progress below.", List.of(result));

        assertTrue(enhanced.contains("**Your Learning Progress:**"));
        assertTrue(enhanced.contains("[excellent] **T0**: 72.3% (8 questions)")
                || enhanced.contains("[excellent] **T0**: 72.2% (8 questions)"));
        assertTrue(enhanced.contains("**T4**"));
        assertFalse(enhanced.contains("**T5**"));
    }

    @Test
    void testUnsuccessfulOrPlainPayloadsAreIgnored() throws Exception {
        List<ToolResult> results = List.of(
                ToolResult.success(0, "a", objectMapper.readTree("{\"success\": false, \"question\": {\"text\": \"Q\"}}")),
                ToolResult.success(1, "b", TextNode.valueOf("plain text")),
                ToolResult.failure(2, "c", FailureKind.TOOL_TIMEOUT, "late"));

        assertEquals("Answer", formatter.enhance("Answer", results));
    }
}
