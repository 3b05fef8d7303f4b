package com.lexcoach.repository;

import com.lexcoach.entity.ToolCallLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link ToolCallLog} entities.
 */
public interface ToolCallLogRepository extends JpaRepository<ToolCallLog, UUID> {

    List<ToolCallLog> findByRunIdOrderByInvocationIndexAsc(String runId);
}
