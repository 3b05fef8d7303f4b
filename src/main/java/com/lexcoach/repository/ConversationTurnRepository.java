package com.lexcoach.repository;

import com.lexcoach.entity.ConversationTurnRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link ConversationTurnRecord} entities.
 */
public interface ConversationTurnRepository extends JpaRepository<ConversationTurnRecord, UUID> {

    List<ConversationTurnRecord> findByUserIdAndSessionIdOrderByTurnTimestampDesc(String userId, String sessionId,
                                                                                 Pageable pageable);

    long countByUserIdAndSessionId(String userId, String sessionId);
}
