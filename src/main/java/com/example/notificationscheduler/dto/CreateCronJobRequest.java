package com.example.notificationscheduler.dto;

import com.example.notificationscheduler.domain.enums.JobType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a cron job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateCronJobRequest {

    @NotBlank(message = "Name is required")
    private String name;

    private String description;

    /**
     * Five fields: minute hour day month weekday, in UTC
     */
    @NotBlank(message = "Cron expression is required")
    private String cronExpression;

    @NotNull(message = "Job type is required")
    private JobType jobType;

    /**
     * JSON object. For notification_check jobs it must contain title and message.
     */
    private JsonNode jobData;

    /**
     * Defaults to true
     */
    @JsonProperty("isActive")
    private Boolean active;

    private String createdBy;
}
