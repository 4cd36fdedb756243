package com.example.notificationscheduler.dto;

import com.example.notificationscheduler.domain.enums.JobType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a cron job; null fields are left unchanged
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateCronJobRequest {

    private String name;
    private String description;
    private String cronExpression;
    private JobType jobType;
    private JsonNode jobData;

    @JsonProperty("isActive")
    private Boolean active;
}
