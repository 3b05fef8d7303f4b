package com.lexcoach.repository;

import com.lexcoach.entity.RunCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Repository interface for managing {@link RunCheckpoint} entities.
 */
public interface RunCheckpointRepository extends JpaRepository<RunCheckpoint, String> {

    /**
     * Flips the claim flag if nobody has claimed the checkpoint yet.
     *
     * @return 1 when this caller won the claim, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update RunCheckpoint c set c.claimed = true where c.runId = :runId and c.claimed = false")
    int claim(@Param("runId") String runId);

    List<RunCheckpoint> findByUserIdAndSessionIdAndClaimedFalseOrderByCreatedAtDesc(String userId, String sessionId);
}
