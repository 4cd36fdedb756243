package com.example.notificationscheduler.controller;

import com.example.notificationscheduler.dto.ActiveJobResponse;
import com.example.notificationscheduler.dto.ApiResponse;
import com.example.notificationscheduler.dto.CreateCronJobRequest;
import com.example.notificationscheduler.dto.CronJobResponse;
import com.example.notificationscheduler.dto.UpdateCronJobRequest;
import com.example.notificationscheduler.service.CronJobManagementService;
import com.example.notificationscheduler.service.handler.JobExecutionResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for cron job definitions.
 * <p>
 * Provides endpoints for:
 * - CRUD on definitions
 * - Starting, stopping and manually executing a job
 * - Listing the live tasks held by the scheduler
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/cronjobs")
@Tag(name = "Cron Jobs", description = "APIs for managing cron job definitions")
public class CronJobController {

    private final CronJobManagementService cronJobManagementService;

    @GetMapping
    @Operation(summary = "List cron jobs", description = "All definitions, newest first")
    public ResponseEntity<ApiResponse<List<CronJobResponse>>> getAll() {
        return ResponseEntity.ok(ApiResponse.success(cronJobManagementService.getAll()));
    }

    @GetMapping("/active-in-memory")
    @Operation(summary = "List live tasks", description = "Cron jobs currently scheduled in this process")
    public ResponseEntity<ApiResponse<List<ActiveJobResponse>>> getActiveInMemory() {
        return ResponseEntity.ok(ApiResponse.success(cronJobManagementService.getActiveInMemory()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get cron job by ID")
    public ResponseEntity<ApiResponse<CronJobResponse>> getById(@Parameter(description = "Cron job UUID") @PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(cronJobManagementService.getById(id)));
    }

    @PostMapping
    @Operation(summary = "Create a cron job", description = "Validate, store and schedule a new definition")
    public ResponseEntity<ApiResponse<CronJobResponse>> create(@Valid @RequestBody CreateCronJobRequest request) {
        log.info("API: Create cron job '{}' of type {}", request.getName(), request.getJobType());

        var response = cronJobManagementService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Cron job created successfully"));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a cron job", description = "Partial update; the live task is rebuilt from the new state")
    public ResponseEntity<ApiResponse<CronJobResponse>> update(
            @Parameter(description = "Cron job UUID") @PathVariable UUID id,
            @RequestBody UpdateCronJobRequest request) {
        log.info("API: Update cron job {}", id);

        return ResponseEntity.ok(ApiResponse.success(cronJobManagementService.update(id, request), "Cron job updated successfully"));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a cron job")
    public ResponseEntity<ApiResponse<Void>> delete(@Parameter(description = "Cron job UUID") @PathVariable UUID id) {
        log.info("API: Delete cron job {}", id);

        cronJobManagementService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Cron job deleted successfully"));
    }

    @PostMapping("/{id}/start")
    @Operation(summary = "Start a cron job", description = "Activate the definition and schedule it")
    public ResponseEntity<ApiResponse<CronJobResponse>> start(@Parameter(description = "Cron job UUID") @PathVariable UUID id) {
        log.info("API: Start cron job {}", id);

        return ResponseEntity.ok(ApiResponse.success(cronJobManagementService.start(id), "Cron job started successfully"));
    }

    @PostMapping("/{id}/stop")
    @Operation(summary = "Stop a cron job", description = "Deactivate the definition and remove its live task")
    public ResponseEntity<ApiResponse<CronJobResponse>> stop(@Parameter(description = "Cron job UUID") @PathVariable UUID id) {
        log.info("API: Stop cron job {}", id);

        return ResponseEntity.ok(ApiResponse.success(cronJobManagementService.stop(id), "Cron job stopped successfully"));
    }

    @PostMapping("/{id}/execute")
    @Operation(summary = "Execute a cron job now", description = "Run the job body once without changing its schedule")
    public ResponseEntity<ApiResponse<JobExecutionResult>> execute(@Parameter(description = "Cron job UUID") @PathVariable UUID id) {
        log.info("API: Execute cron job {}", id);

        return ResponseEntity.ok(ApiResponse.success(cronJobManagementService.execute(id), "Cron job executed successfully"));
    }
}
