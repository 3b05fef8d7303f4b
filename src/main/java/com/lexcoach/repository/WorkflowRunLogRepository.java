package com.lexcoach.repository;

import com.lexcoach.entity.WorkflowRunLog;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository interface for managing {@link WorkflowRunLog} entities.
 */
public interface WorkflowRunLogRepository extends JpaRepository<WorkflowRunLog, String> {
}
