package com.lexcoach.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "resolved_run")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResolvedRun {

    @Id
    @Column(name = "run_id", length = 64)
    private String runId;

    @Column(name = "final_status", length = 30, nullable = false)
    private String finalStatus;

    @CreationTimestamp
    @Column(name = "resolved_at", nullable = false, updatable = false)
    private OffsetDateTime resolvedAt;
}
