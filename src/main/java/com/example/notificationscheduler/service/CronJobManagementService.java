package com.example.notificationscheduler.service;

import com.example.notificationscheduler.domain.entity.CronJob;
import com.example.notificationscheduler.domain.enums.JobStatusEvent;
import com.example.notificationscheduler.domain.repository.CronJobRepository;
import com.example.notificationscheduler.dto.ActiveJobResponse;
import com.example.notificationscheduler.dto.CreateCronJobRequest;
import com.example.notificationscheduler.dto.CronJobResponse;
import com.example.notificationscheduler.dto.UpdateCronJobRequest;
import com.example.notificationscheduler.exception.CronJobNotFoundException;
import com.example.notificationscheduler.exception.JobExecutionException;
import com.example.notificationscheduler.mapper.CronJobMapper;
import com.example.notificationscheduler.service.handler.JobExecutionResult;
import com.example.notificationscheduler.service.handler.payload.JobPayloadParser;
import com.example.notificationscheduler.service.scheduler.CronJobManager;
import com.example.notificationscheduler.validation.CronExpressionValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Service for managing cron job definitions.
 * <p>
 * Every change to a definition is persisted first and then applied to the live
 * scheduler; connected admins are told about starts, stops and manual runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CronJobManagementService {

    private final CronJobRepository cronJobRepository;
    private final CronJobManager cronJobManager;
    private final CronExpressionValidator cronExpressionValidator;
    private final JobPayloadParser payloadParser;
    private final NotificationService notificationService;
    private final CronJobMapper cronJobMapper;

    // === Retrieval ===

    @Transactional(readOnly = true)
    public List<CronJobResponse> getAll() {
        return cronJobMapper.toResponseList(cronJobRepository.findAllByOrderByCreatedAtDesc());
    }

    @Transactional(readOnly = true)
    public CronJobResponse getById(UUID id) {
        return cronJobMapper.toResponse(findOrThrow(id));
    }

    public List<ActiveJobResponse> getActiveInMemory() {
        return cronJobManager.listActive();
    }

    // === Mutation ===

    /**
     * Validate, persist and, when active, schedule a new definition
     */
    public CronJobResponse create(CreateCronJobRequest request) {
        cronExpressionValidator.validate(request.getCronExpression());

        var job = cronJobMapper.toEntity(request);
        job.setCronExpression(request.getCronExpression().trim());
        payloadParser.parseStrict(job.getJobType(), job.getJobData());

        job = cronJobRepository.save(job);
        log.info("Created cron job {} ({}, {}) with '{}'", job.getId(), job.getName(), job.getJobType().getCode(), job.getCronExpression());

        if (Boolean.TRUE.equals(job.getActive())) {
            cronJobManager.addJob(job);
            announceScheduled(job, "created and started");
        }

        return cronJobMapper.toResponse(job);
    }

    /**
     * Apply a partial update and reschedule from the new state
     */
    public CronJobResponse update(UUID id, UpdateCronJobRequest request) {
        var job = findOrThrow(id);

        if (request.getCronExpression() != null) {
            cronExpressionValidator.validate(request.getCronExpression());
        }

        cronJobMapper.updateEntity(request, job);
        if (request.getCronExpression() != null) {
            job.setCronExpression(request.getCronExpression().trim());
        }
        if (request.getJobType() != null || request.getJobData() != null) {
            payloadParser.parseStrict(job.getJobType(), job.getJobData());
        }

        job = cronJobRepository.save(job);
        log.info("Updated cron job {} ({})", job.getId(), job.getName());

        cronJobManager.updateJob(id, job);
        return cronJobMapper.toResponse(job);
    }

    public void delete(UUID id) {
        var job = findOrThrow(id);

        cronJobManager.removeJob(id);
        cronJobRepository.delete(job);
        log.info("Deleted cron job {} ({})", id, job.getName());
    }

    public CronJobResponse start(UUID id) {
        var job = findOrThrow(id);

        job.setActive(true);
        job = cronJobRepository.save(job);
        cronJobManager.addJob(job);

        log.info("Started cron job {} ({})", id, job.getName());
        announceScheduled(job, "started");
        return cronJobMapper.toResponse(job);
    }

    public CronJobResponse stop(UUID id) {
        var job = findOrThrow(id);

        job.setActive(false);
        job = cronJobRepository.save(job);
        cronJobManager.removeJob(id);

        log.info("Stopped cron job {} ({})", id, job.getName());
        notificationService.sendJobStatusToAdmins(id, JobStatusEvent.STOPPED, "Cron job \"" + job.getName() + "\" stopped");
        return cronJobMapper.toResponse(job);
    }

    /**
     * Run a definition's job body now, outside its schedule
     *
     * @throws JobExecutionException when the job fails
     */
    public JobExecutionResult execute(UUID id) {
        var job = findOrThrow(id);
        var payload = payloadParser.parseLenient(job.getJobType(), job.getJobData());

        try {
            var result = cronJobManager.executeDirect(job.getJobType(), payload);
            log.info("Manually executed cron job {} ({})", id, job.getName());
            notificationService.sendJobStatusToAdmins(id, JobStatusEvent.EXECUTED, "Cron job \"" + job.getName() + "\" executed manually");
            return result;
        } catch (JobExecutionException e) {
            notificationService.sendJobStatusToAdmins(id, JobStatusEvent.FAILED,
                    "Cron job \"" + job.getName() + "\" failed: " + e.getMessage());
            throw e;
        }
    }

    /**
     * A one-time job past its target runs once inside addJob and comes back inactive
     */
    private void announceScheduled(CronJob job, String action) {
        if (Boolean.TRUE.equals(job.getActive())) {
            notificationService.sendJobStatusToAdmins(job.getId(), JobStatusEvent.STARTED,
                    "Cron job \"" + job.getName() + "\" " + action);
        } else {
            notificationService.sendJobStatusToAdmins(job.getId(), JobStatusEvent.EXECUTED,
                    "Cron job \"" + job.getName() + "\" was past its one-time schedule, executed once and deactivated");
        }
    }

    private CronJob findOrThrow(UUID id) {
        return cronJobRepository.findById(id).orElseThrow(() -> new CronJobNotFoundException(id));
    }
}
