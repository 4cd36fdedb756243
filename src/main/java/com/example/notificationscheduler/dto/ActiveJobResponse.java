package com.example.notificationscheduler.dto;

import com.example.notificationscheduler.domain.enums.JobType;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A live cron task held in memory
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveJobResponse {

    private UUID id;
    private String name;
    private JobType jobType;
    private String cronExpression;
    private boolean oneTime;

    @JsonProperty("isRunning")
    private boolean running;
}
