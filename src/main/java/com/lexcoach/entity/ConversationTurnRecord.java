package com.lexcoach.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "conversation_turn",
        indexes = @Index(name = "idx_conversation_turn_session", columnList = "user_id, session_id, turn_timestamp"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationTurnRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "turn_id", length = 64, nullable = false, unique = true)
    private String turnId;

    @Column(name = "user_id", length = 100, nullable = false)
    private String userId;

    @Column(name = "session_id", length = 100, nullable = false)
    private String sessionId;

    @Column(name = "run_id", length = 64)
    private String runId;

    @Column(name = "user_text", nullable = false, columnDefinition = "TEXT")
    private String userText;

    @Column(name = "answer", columnDefinition = "TEXT")
    private String answer;

    @Column(name = "feedback", columnDefinition = "TEXT")
    private String feedback;

    @Column(name = "turn_timestamp", nullable = false)
    private OffsetDateTime turnTimestamp;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
