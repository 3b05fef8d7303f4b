package com.lexcoach.repository;

import com.lexcoach.entity.ConversationTurnRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ConversationTurnRepositoryTest extends BaseRepositoryTest {

    @Autowired
    private ConversationTurnRepository conversationTurnRepository;

    private ConversationTurnRecord turn(String text, int minute) {
        return ConversationTurnRecord.builder()
                .turnId(UUID.randomUUID().toString())
                .userId("u1")
                .sessionId("s1")
                .userText(text)
                .answer("answer to " + text)
                .turnTimestamp(OffsetDateTime.of(2026, 1, 1, 10, minute, 0, 0, ZoneOffset.UTC))
                .build();
    }

    @Test
    void testNewestTurnsFirstWithLimit() {
        conversationTurnRepository.save(turn("first", 1));
        conversationTurnRepository.save(turn("third", 3));
        conversationTurnRepository.save(turn("second", 2));

        List<ConversationTurnRecord> recent = conversationTurnRepository
                .findByUserIdAndSessionIdOrderByTurnTimestampDesc("u1", "s1", PageRequest.of(0, 2));

        assertEquals(List.of("third", "second"), recent.stream().map(ConversationTurnRecord::getUserText).toList());
        assertEquals(3, conversationTurnRepository.countByUserIdAndSessionId("u1", "s1"));
        assertEquals(0, conversationTurnRepository.countByUserIdAndSessionId("u1", "other"));
    }
}
