package com.cronq;

import com.cronq.schedule.ScheduleExpression;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Row storage for jobs. Every mutation applied after an attempt is guarded by the
 * claiming node's lock and the attempt count it read, so a row is only changed by
 * the worker that holds it.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Aggregated lifecycle counters fetched in a single query.
     */
    interface LifecycleCounts {
        Long getPendingCount();

        Long getProcessingCount();

        Long getFailedCount();
    }

    /**
     * Due rows of a type, including rows whose lock is older than
     * {@code staleBefore}: their holder crashed or failed to record the attempt.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({ @QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2") }) // SKIP LOCKED
    @Query("""
            SELECT j FROM Job j
            WHERE j.type = :type
              AND j.failedAt IS NULL
              AND j.runAt <= :now
              AND (j.processingStartedAt IS NULL OR j.lockedAt < :staleBefore)
            ORDER BY j.runAt ASC, j.createdAt ASC
            """)
    List<Job> findNextJobsForUpdate(@Param("type") String type, @Param("now") OffsetDateTime now,
            @Param("staleBefore") OffsetDateTime staleBefore, Pageable pageable);

    @Query("""
            SELECT
              COALESCE(SUM(CASE
                WHEN j.processingStartedAt IS NULL AND j.failedAt IS NULL
                THEN 1 ELSE 0 END), 0) AS pendingCount,
              COALESCE(SUM(CASE
                WHEN j.processingStartedAt IS NOT NULL AND j.failedAt IS NULL
                THEN 1 ELSE 0 END), 0) AS processingCount,
              COALESCE(SUM(CASE
                WHEN j.failedAt IS NOT NULL
                THEN 1 ELSE 0 END), 0) AS failedCount
            FROM Job j
            """)
    LifecycleCounts countLifecycleCounts();

    @Modifying
    @Transactional
    int deleteByFailedAtBefore(OffsetDateTime failedAt);

    boolean existsByTypeAndScheduleAndFailedAtIsNull(String type, ScheduleExpression schedule);

    /**
     * Releases a claimed row for another run at {@code nextRunAt}. Used both for
     * recurring reschedules and for retries of one-shot jobs.
     */
    @Modifying
    @Query("""
            UPDATE Job j
            SET j.attempts = :nextAttempts,
                j.lastError = :lastError,
                j.runAt = :nextRunAt,
                j.updatedAt = :now,
                j.processingStartedAt = NULL,
                j.failedAt = NULL,
                j.lockedAt = NULL,
                j.lockedBy = NULL
            WHERE j.id = :id
              AND j.attempts = :expectedAttempts
              AND j.processingStartedAt IS NOT NULL
              AND j.failedAt IS NULL
              AND j.lockedBy = :lockedBy
            """)
    int markPending(
            @Param("id") UUID id,
            @Param("expectedAttempts") int expectedAttempts,
            @Param("nextAttempts") int nextAttempts,
            @Param("lastError") String lastError,
            @Param("nextRunAt") OffsetDateTime nextRunAt,
            @Param("now") OffsetDateTime now,
            @Param("lockedBy") String lockedBy);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.attempts = :nextAttempts,
                j.lastError = :lastError,
                j.updatedAt = :now,
                j.failedAt = :now,
                j.lockedAt = NULL,
                j.lockedBy = NULL
            WHERE j.id = :id
              AND j.attempts = :expectedAttempts
              AND j.processingStartedAt IS NOT NULL
              AND j.failedAt IS NULL
              AND j.lockedBy = :lockedBy
            """)
    int markFailedTerminal(
            @Param("id") UUID id,
            @Param("expectedAttempts") int expectedAttempts,
            @Param("nextAttempts") int nextAttempts,
            @Param("lastError") String lastError,
            @Param("now") OffsetDateTime now,
            @Param("lockedBy") String lockedBy);

    @Modifying
    @Query("""
            DELETE FROM Job j
            WHERE j.id = :id
              AND j.attempts = :expectedAttempts
              AND j.lockedBy = :lockedBy
            """)
    int deleteClaimed(
            @Param("id") UUID id,
            @Param("expectedAttempts") int expectedAttempts,
            @Param("lockedBy") String lockedBy);
}
