package com.lexcoach.orchestration.service;

import com.lexcoach.orchestration.api.MemoryStore;
import com.lexcoach.orchestration.model.SessionKey;
import com.lexcoach.orchestration.model.Turn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryMemoryStore implements MemoryStore {

    private final Map<SessionKey, List<Turn>> sessions = new ConcurrentHashMap<>();

    @Override
    public void append(SessionKey session, Turn turn) {
        sessions.computeIfAbsent(session, key -> Collections.synchronizedList(new ArrayList<>())).add(turn);
    }

    @Override
    public List<Turn> recent(SessionKey session, int limit) {
        List<Turn> turns = sessions.get(session);
        if (turns == null || limit <= 0) {
            return List.of();
        }
        synchronized (turns) {
            int from = Math.max(0, turns.size() - limit);
            return List.copyOf(turns.subList(from, turns.size()));
        }
    }
}
