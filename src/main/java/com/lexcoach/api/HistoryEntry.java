package com.lexcoach.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lexcoach.orchestration.model.Turn;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryEntry(
        String human,
        String ai,
        Instant timestamp,
        String feedback
) {

    public static HistoryEntry from(Turn turn) {
        return new HistoryEntry(turn.userText(), turn.answer(), turn.timestamp(), turn.feedback());
    }
}
