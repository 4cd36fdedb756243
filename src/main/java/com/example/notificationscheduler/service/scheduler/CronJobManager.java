package com.example.notificationscheduler.service.scheduler;

import com.example.notificationscheduler.config.CronSchedulerProperties;
import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.domain.entity.CronJob;
import com.example.notificationscheduler.domain.enums.JobStatusEvent;
import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.domain.repository.CronJobRepository;
import com.example.notificationscheduler.dto.ActiveJobResponse;
import com.example.notificationscheduler.exception.JobExecutionException;
import com.example.notificationscheduler.service.NotificationService;
import com.example.notificationscheduler.service.alert.SlackAlertService;
import com.example.notificationscheduler.service.handler.JobExecutionResult;
import com.example.notificationscheduler.service.handler.JobHandlerRegistry;
import com.example.notificationscheduler.service.handler.payload.JobPayload;
import com.example.notificationscheduler.service.handler.payload.JobPayloadParser;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the live cron tasks of this process.
 * <p>
 * Each active definition has at most one live task keyed by its id. A task fires on
 * the cron job scheduler in UTC, runs the handler for its job type and records the run.
 * One-time jobs deactivate and remove themselves after a successful fire; one-time jobs
 * whose target instant has already passed run once immediately and are never scheduled.
 * <p>
 * Add and remove are serialized on a single lock so that replacing a task is atomic
 * with respect to other mutators. A failing fire is logged, counted and alerted, and the
 * task stays scheduled.
 */
@Slf4j
@Service
public class CronJobManager {

    private final Map<UUID, LiveCronTask> liveTasks = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    private final TaskScheduler taskScheduler;
    private final CronJobRepository cronJobRepository;
    private final JobHandlerRegistry handlerRegistry;
    private final JobPayloadParser payloadParser;
    private final NotificationService notificationService;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final CronSchedulerProperties properties;
    private final Clock clock;

    public CronJobManager(@Qualifier("cronJobTaskScheduler") TaskScheduler taskScheduler,
                          CronJobRepository cronJobRepository,
                          JobHandlerRegistry handlerRegistry,
                          JobPayloadParser payloadParser,
                          NotificationService notificationService,
                          SlackAlertService slackAlertService,
                          MetricsConfig metricsConfig,
                          CronSchedulerProperties properties,
                          Clock clock) {
        this.taskScheduler = taskScheduler;
        this.cronJobRepository = cronJobRepository;
        this.handlerRegistry = handlerRegistry;
        this.payloadParser = payloadParser;
        this.notificationService = notificationService;
        this.slackAlertService = slackAlertService;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.clock = clock;
    }

    // ========== Lifecycle ==========

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isLoadOnStartup()) {
            log.info("Loading cron jobs on startup is disabled");
            return;
        }
        loadAll();
    }

    /**
     * Install a live task for every active definition, oldest first
     *
     * @return number of definitions that were added without error
     */
    public int loadAll() {
        var jobs = cronJobRepository.findByActiveTrueOrderByCreatedAtAsc();
        var loaded = 0;

        for (var job : jobs) {
            try {
                addJob(job);
                loaded++;
            } catch (Exception e) {
                log.error("Failed to load cron job {} ({}): {}", job.getId(), job.getName(), e.getMessage(), e);
                slackAlertService.sendJobLoadFailureAlert(job.getId(), job.getName(), job.getCronExpression(), e.getMessage());
            }
        }

        log.info("Loaded {} of {} active cron jobs", loaded, jobs.size());
        return loaded;
    }

    @PreDestroy
    public void shutdown() {
        synchronized (lock) {
            log.info("Stopping {} live cron tasks", liveTasks.size());
            liveTasks.values().forEach(LiveCronTask::cancel);
            liveTasks.clear();
        }
        metricsConfig.updateLiveCronTasks(0);
    }

    // ========== Transitions ==========

    /**
     * Replace any live task for this definition with a new one built from its current state.
     * An expired one-time definition is executed immediately and deactivated instead.
     *
     * @throws IllegalArgumentException if the cron expression cannot be parsed
     */
    public void addJob(CronJob job) {
        var schedule = CronSchedule.parse(job.getCronExpression());
        var payload = payloadParser.parseLenient(job.getJobType(), job.getJobData());
        var snapshot = ScheduledJobSnapshot.of(job, schedule, payload);
        var now = clock.instant();

        if (schedule.isExpired(now)) {
            synchronized (lock) {
                cancelLiveTask(job.getId());
            }
            log.info("One-time cron job {} ({}) is past its target time, executing now and deactivating",
                    job.getId(), job.getName());
            runExpired(snapshot);
            deactivate(job.getId());
            job.setActive(false);
            metricsConfig.updateLiveCronTasks(liveTasks.size());
            return;
        }

        synchronized (lock) {
            cancelLiveTask(job.getId());

            var trigger = new CronTrigger(schedule.toSpringExpression(), ZoneOffset.UTC);
            var future = taskScheduler.schedule(() -> fire(snapshot), trigger);
            if (future == null) {
                log.warn("Cron job {} ({}) with schedule '{}' has no upcoming fire, not scheduled",
                        job.getId(), job.getName(), schedule);
                return;
            }
            liveTasks.put(job.getId(), new LiveCronTask(snapshot, future, now));
        }

        log.info("Scheduled cron job {} ({}, {}) with '{}'{}", job.getId(), job.getName(),
                job.getJobType().getCode(), schedule, schedule.isOneTime() ? " (one-time)" : "");
        metricsConfig.updateLiveCronTasks(liveTasks.size());
    }

    /**
     * Cancel the live task of a definition; no-op when none exists
     */
    public void removeJob(UUID id) {
        boolean removed;
        synchronized (lock) {
            removed = cancelLiveTask(id);
        }
        if (removed) {
            log.info("Removed live task of cron job {}", id);
            metricsConfig.updateLiveCronTasks(liveTasks.size());
        }
    }

    public void updateJob(UUID id, CronJob job) {
        removeJob(id);
        if (Boolean.TRUE.equals(job.getActive())) {
            addJob(job);
        }
    }

    /**
     * Run a job body once without touching its definition
     *
     * @throws JobExecutionException when the handler reports a failure or throws
     */
    public JobExecutionResult executeDirect(JobType jobType, JobPayload payload) {
        JobExecutionResult result;
        try {
            result = runHandler(jobType, payload);
        } catch (Exception e) {
            throw new JobExecutionException(jobType, e);
        }
        if (!result.isSuccess()) {
            throw new JobExecutionException(jobType, result.getErrorMessage());
        }
        return result;
    }

    public List<ActiveJobResponse> listActive() {
        return liveTasks.values().stream()
                .sorted(Comparator.comparing(LiveCronTask::getInstalledAt))
                .map(task -> ActiveJobResponse.builder()
                        .id(task.getSnapshot().getId())
                        .name(task.getSnapshot().getName())
                        .jobType(task.getSnapshot().getJobType())
                        .cronExpression(task.getSnapshot().getSchedule().getExpression())
                        .oneTime(task.getSnapshot().isOneTime())
                        .running(true)
                        .build())
                .toList();
    }

    public boolean isScheduled(UUID id) {
        return liveTasks.containsKey(id);
    }

    // ========== Firing ==========

    /**
     * Body of a live task. Never throws.
     */
    void fire(ScheduledJobSnapshot snapshot) {
        var fireStart = clock.instant();
        log.info("Firing cron job {} ({})", snapshot.getId(), snapshot.getName());

        var result = runTimed(snapshot);
        if (!result.isSuccess()) {
            handleFailure(snapshot, result);
            return;
        }

        try {
            var nextRun = snapshot.isOneTime() ? null : snapshot.getSchedule().nextRun(clock.instant()).orElse(null);
            cronJobRepository.updateLastRun(snapshot.getId(), fireStart, nextRun, clock.instant());
        } catch (Exception e) {
            log.error("Failed to record run of cron job {}: {}", snapshot.getId(), e.getMessage(), e);
        }

        if (snapshot.isOneTime()) {
            log.info("One-time cron job {} ({}) fired, deactivating", snapshot.getId(), snapshot.getName());
            deactivate(snapshot.getId());
            removeIfCurrent(snapshot);
        }
    }

    private void runExpired(ScheduledJobSnapshot snapshot) {
        var result = runTimed(snapshot);
        if (!result.isSuccess()) {
            handleFailure(snapshot, result);
        }
    }

    private JobExecutionResult runTimed(ScheduledJobSnapshot snapshot) {
        var sample = metricsConfig.startJobExecutionTimer();
        JobExecutionResult result;
        try {
            result = runHandler(snapshot.getJobType(), snapshot.getPayload());
        } catch (Exception e) {
            log.error("Cron job {} threw: {}", snapshot.getId(), e.getMessage(), e);
            result = JobExecutionResult.failure(e);
        }
        metricsConfig.recordJobExecution(sample, snapshot.getJobType(), result.isSuccess());
        return result;
    }

    private JobExecutionResult runHandler(JobType jobType, JobPayload payload) {
        var handler = handlerRegistry.getHandler(jobType);
        if (handler.isEmpty()) {
            log.warn("No handler registered for job type {}, skipping", jobType);
            return JobExecutionResult.skipped("No handler registered for job type " + jobType.getCode());
        }
        return handler.get().execute(payload);
    }

    private void handleFailure(ScheduledJobSnapshot snapshot, JobExecutionResult result) {
        log.error("Cron job {} ({}) failed: {}", snapshot.getId(), snapshot.getName(), result.getErrorMessage());
        metricsConfig.recordJobFailure(snapshot.getJobType(), result.getErrorType());
        slackAlertService.sendJobFailureAlert(snapshot.getId(), snapshot.getName(), snapshot.getJobType(), result.getErrorMessage());
        notificationService.sendJobStatusToAdmins(snapshot.getId(), JobStatusEvent.FAILED,
                "Cron job \"" + snapshot.getName() + "\" failed: " + result.getErrorMessage());
    }

    private void deactivate(UUID id) {
        try {
            cronJobRepository.updateActive(id, false, clock.instant());
        } catch (Exception e) {
            log.error("Failed to deactivate cron job {}: {}", id, e.getMessage(), e);
        }
    }

    /**
     * Remove the live task only if it still fires this snapshot, so a concurrent re-add survives
     */
    private void removeIfCurrent(ScheduledJobSnapshot snapshot) {
        synchronized (lock) {
            var live = liveTasks.get(snapshot.getId());
            if (live != null && live.getSnapshot() == snapshot) {
                liveTasks.remove(snapshot.getId());
                live.cancel();
            }
        }
        metricsConfig.updateLiveCronTasks(liveTasks.size());
    }

    private boolean cancelLiveTask(UUID id) {
        var existing = liveTasks.remove(id);
        if (existing == null) {
            return false;
        }
        existing.cancel();
        return true;
    }
}
