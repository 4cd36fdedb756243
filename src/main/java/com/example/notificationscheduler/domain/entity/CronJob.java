package com.example.notificationscheduler.domain.entity;

import com.example.notificationscheduler.domain.enums.JobType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted cron job definition.
 * <p>
 * The running timer for an active definition lives only in memory and is
 * rebuilt from this row each time the job is (re)loaded.
 */
@Entity
@Table(name = "cron_jobs", indexes = {
        @Index(name = "idx_cron_job_active_created", columnList = "is_active, created_at"),
        @Index(name = "idx_cron_job_type", columnList = "job_type")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CronJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    /**
     * Five-field cron expression: minute hour day-of-month month day-of-week, evaluated in UTC
     */
    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 50)
    private JobType jobType;

    /**
     * JSON text interpreted by the handler for the job type
     */
    @Column(name = "job_data", columnDefinition = "TEXT")
    private String jobData;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    @Column(name = "last_run")
    private Instant lastRun;

    @Column(name = "next_run")
    private Instant nextRun;

    /**
     * User id of the creator, if known
     */
    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.active == null) {
            this.active = true;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
