package com.lexcoach;

import com.lexcoach.tools.CoachingTool;
import com.lexcoach.tools.StubTool;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

@TestConfiguration
public class MockTestConfig {

    public static final String ESSAY_TOOL = "grade_essay";

    @Bean
    public StubTool gradeEssayTool() {
        return StubTool.returning(ESSAY_TOOL, "{\"success\": true, \"score\": 8}").markSensitive();
    }

    @Bean
    public CoachingTool learningProgressTool() {
        return StubTool.returning("get_learning_progress", """
                {"success": true, "analytics": {"topics": [
                  {"topic": "Legal Reasoning", "status": "good", "accuracy": 64.0, "total_questions": 25}]}}
                """);
    }
}
