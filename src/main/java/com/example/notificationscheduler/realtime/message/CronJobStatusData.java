package com.example.notificationscheduler.realtime.message;

import com.example.notificationscheduler.domain.enums.JobStatusEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronJobStatusData {

    private UUID cronJobId;
    private JobStatusEvent status;
    private String message;
    private Instant timestamp;
}
