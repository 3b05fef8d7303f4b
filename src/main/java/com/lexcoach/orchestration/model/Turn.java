package com.lexcoach.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.UUID;

/**
 * One user utterance and, once the run that produced it completes, the assistant answer.
 * {@code feedback} carries reviewer text from a rejected or modified plan so later planning passes can see it.
 */
public record Turn(
        String turnId,
        SessionKey session,
        String userText,
        @Nullable String answer,
        @Nullable String runId,
        Instant timestamp,
        @Nullable String feedback
) {

    public static Turn of(SessionKey session, String userText) {
        return new Turn(UUID.randomUUID().toString(), session, userText, null, null, Instant.now(), null);
    }

    public Turn withRunId(String runId) {
        return new Turn(turnId, session, userText, answer, runId, timestamp, feedback);
    }

    public Turn withAnswer(String answer) {
        return new Turn(turnId, session, userText, answer, runId, timestamp, feedback);
    }

    public Turn withFeedback(@Nullable String feedback) {
        return new Turn(turnId, session, userText, answer, runId, timestamp, feedback);
    }
}
