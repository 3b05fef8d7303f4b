package com.lexcoach.orchestration.service;

import com.lexcoach.entity.ConversationTurnRecord;
import com.lexcoach.orchestration.api.MemoryStore;
import com.lexcoach.orchestration.model.SessionKey;
import com.lexcoach.orchestration.model.Turn;
import com.lexcoach.repository.ConversationTurnRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class JpaMemoryStore implements MemoryStore {

    private final ConversationTurnRepository turnRepository;

    public JpaMemoryStore(ConversationTurnRepository turnRepository) {
        this.turnRepository = turnRepository;
    }

    @Override
    @Transactional
    public void append(SessionKey session, Turn turn) {
        ConversationTurnRecord record = ConversationTurnRecord.builder()
                .turnId(turn.turnId())
                .userId(session.userId())
                .sessionId(session.sessionId())
                .runId(turn.runId())
                .userText(turn.userText())
                .answer(turn.answer())
                .feedback(turn.feedback())
                .turnTimestamp(turn.timestamp().atOffset(ZoneOffset.UTC))
                .build();
        turnRepository.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Turn> recent(SessionKey session, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<ConversationTurnRecord> newestFirst = turnRepository.findByUserIdAndSessionIdOrderByTurnTimestampDesc(
                session.userId(), session.sessionId(), PageRequest.of(0, limit));
        List<Turn> turns = new ArrayList<>(newestFirst.size());
        for (ConversationTurnRecord record : newestFirst) {
            turns.add(new Turn(record.getTurnId(), session, record.getUserText(), record.getAnswer(),
                    record.getRunId(), record.getTurnTimestamp().toInstant(), record.getFeedback()));
        }
        Collections.reverse(turns);
        return turns;
    }
}
