package com.lexcoach.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexcoach.orchestration.api.MemoryStore;
import com.lexcoach.orchestration.model.SessionKey;
import com.lexcoach.orchestration.model.Turn;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lets the planner pull a longer slice of the session history than the planner memory window.
 */
@Component
public class ConversationRecapTool implements CoachingTool {

    static final String NAME = "conversation_recap";
    private static final int MAX_TURNS = 50;
    private static final String SCHEMA = """
            {
              "type": "object",
              "properties": {
                "user_id": {"type": "string", "description": "learner whose history is read"},
                "session_id": {"type": "string", "description": "session to recap, defaults to 'default'"},
                "limit": {"type": "integer", "minimum": 1, "maximum": 50, "description": "number of turns to return"}
              },
              "required": ["user_id"]
            }
            """;

    private final MemoryStore memoryStore;
    private final JsonNode schema;

    public ConversationRecapTool(MemoryStore memoryStore, ObjectMapper objectMapper) throws Exception {
        this.memoryStore = memoryStore;
        this.schema = objectMapper.readTree(SCHEMA);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Recap earlier questions and answers of the learner's current study session.";
    }

    @Override
    public Optional<JsonNode> schema() {
        return Optional.of(schema);
    }

    @Override
    public Object invoke(Map<String, Object> arguments) {
        String userId = String.valueOf(arguments.get("user_id"));
        Object sessionId = arguments.get("session_id");
        int limit = arguments.get("limit") instanceof Number number
                ? Math.max(1, Math.min(MAX_TURNS, number.intValue()))
                : 10;
        List<Turn> turns = memoryStore.recent(SessionKey.of(userId, sessionId == null ? null : sessionId.toString()), limit);
        List<Map<String, Object>> entries = new ArrayList<>(turns.size());
        for (Turn turn : turns) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("human", turn.userText());
            entry.put("ai", turn.answer());
            entry.put("timestamp", turn.timestamp().toString());
            entries.add(entry);
        }
        return Map.of("turns", entries, "count", entries.size());
    }
}
