package com.example.notificationscheduler.domain.repository;

import com.example.notificationscheduler.domain.entity.CronJob;
import com.example.notificationscheduler.domain.enums.JobType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for cron job definitions.
 * <p>
 * The modifying queries are called from scheduler threads outside any service
 * transaction, so they open their own.
 */
@Repository
public interface CronJobRepository extends JpaRepository<CronJob, UUID> {

    /**
     * All definitions, newest first
     */
    List<CronJob> findAllByOrderByCreatedAtDesc();

    /**
     * Active definitions in creation order, used to rebuild live tasks on startup
     */
    List<CronJob> findByActiveTrueOrderByCreatedAtAsc();

    long countByActiveTrue();

    long countByJobTypeAndActiveTrue(JobType jobType);

    /**
     * Record a completed fire
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE CronJob j
            SET j.lastRun = :lastRun,
                j.nextRun = :nextRun,
                j.updatedAt = :now
            WHERE j.id = :id
            """)
    int updateLastRun(@Param("id") UUID id, @Param("lastRun") Instant lastRun, @Param("nextRun") Instant nextRun, @Param("now") Instant now);

    /**
     * Flip the active flag without loading the entity
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE CronJob j
            SET j.active = :active,
                j.updatedAt = :now
            WHERE j.id = :id
            """)
    int updateActive(@Param("id") UUID id, @Param("active") boolean active, @Param("now") Instant now);
}
