package com.lexcoach.orchestration.api;

import com.lexcoach.orchestration.model.SessionKey;
import com.lexcoach.orchestration.model.Turn;

import java.util.List;

/**
 * Append-only conversation log per session.
 */
public interface MemoryStore {

    /**
     * Appends a committed turn to the session.
     *
     * @param session the owning session.
     * @param turn a turn carrying its final answer.
     */
    void append(SessionKey session, Turn turn);

    /**
     * Returns the most recent turns in chronological order (oldest first).
     *
     * @param session the owning session.
     * @param limit the maximum number of turns to return.
     * @return up to {@code limit} turns.
     */
    List<Turn> recent(SessionKey session, int limit);
}
