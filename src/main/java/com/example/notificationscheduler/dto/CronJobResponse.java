package com.example.notificationscheduler.dto;

import com.example.notificationscheduler.domain.enums.JobType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for cron job data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronJobResponse {

    private UUID id;
    private String name;
    private String description;
    private String cronExpression;
    private JobType jobType;
    private JsonNode jobData;

    @JsonProperty("isActive")
    private Boolean active;

    private Instant lastRun;
    private Instant nextRun;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;
}
