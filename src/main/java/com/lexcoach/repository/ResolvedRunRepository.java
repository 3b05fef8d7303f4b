package com.lexcoach.repository;

import com.lexcoach.entity.ResolvedRun;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository interface for managing {@link ResolvedRun} entities.
 */
public interface ResolvedRunRepository extends JpaRepository<ResolvedRun, String> {
}
