package com.lexcoach.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

/**
 * Durable copy of a suspended run. {@code claimed} flips exactly once, when a decision starts resolving the run.
 */
@Entity
@Table(name = "run_checkpoint",
        indexes = @Index(name = "idx_run_checkpoint_session", columnList = "user_id, session_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunCheckpoint {

    @Id
    @Column(name = "run_id", length = 64)
    private String runId;

    @Column(name = "user_id", length = 100, nullable = false)
    private String userId;

    @Column(name = "session_id", length = 100, nullable = false)
    private String sessionId;

    @Column(name = "status", length = 30, nullable = false)
    private String status;

    @Builder.Default
    @Column(name = "claimed", nullable = false)
    private boolean claimed = false;

    @Column(name = "state_json", nullable = false, columnDefinition = "TEXT")
    private String stateJson;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
