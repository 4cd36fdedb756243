package com.example.notificationscheduler.service.handler;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.service.handler.payload.CustomPayload;
import com.example.notificationscheduler.service.handler.payload.JobPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Handler for CUSTOM jobs. Logs the job data; malformed data is reported and the run still succeeds.
 */
@Slf4j
@Component
public class CustomJobHandler implements JobHandler {

    @Override
    public JobType getJobType() {
        return JobType.CUSTOM;
    }

    @Override
    public JobExecutionResult execute(JobPayload payload) {
        var data = payload instanceof CustomPayload ? (CustomPayload) payload : CustomPayload.EMPTY;

        if (data.isMalformed()) {
            log.warn("Custom job data could not be parsed ({}): {}", data.getFormatError(), data.getRaw());
            return JobExecutionResult.success().withNotes(data.getFormatError());
        }

        log.info("Executing custom job with data: {}", data.getData());
        return JobExecutionResult.success();
    }
}
