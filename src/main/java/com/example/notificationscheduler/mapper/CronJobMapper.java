package com.example.notificationscheduler.mapper;

import com.example.notificationscheduler.domain.entity.CronJob;
import com.example.notificationscheduler.dto.CronJobResponse;
import com.example.notificationscheduler.dto.CreateCronJobRequest;
import com.example.notificationscheduler.dto.UpdateCronJobRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.mapstruct.BeanMapping;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between cron job entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface CronJobMapper {

    CronJobResponse toResponse(CronJob cronJob);

    List<CronJobResponse> toResponseList(List<CronJob> cronJobs);

    /**
     * New definition from a create request, active unless stated otherwise
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "lastRun", ignore = true)
    @Mapping(target = "nextRun", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(target = "active", source = "active", defaultValue = "true")
    CronJob toEntity(CreateCronJobRequest request);

    /**
     * Apply the non-null fields of an update request
     */
    @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "lastRun", ignore = true)
    @Mapping(target = "nextRun", ignore = true)
    @Mapping(target = "createdBy", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    void updateEntity(UpdateCronJobRequest request, @MappingTarget CronJob cronJob);

    /**
     * Shared reader for stored job data; thread-safe once configured
     */
    ObjectMapper JOB_DATA_READER = new ObjectMapper();

    /**
     * Job data is stored as JSON text. A JSON-encoded string is stored as its content, so
     * {@code "{\"title\":\"Hi\"}"} and {@code {"title":"Hi"}} persist the same text.
     * An explicit JSON null clears it.
     */
    default String jobDataToText(JsonNode jobData) {
        if (jobData == null || jobData.isNull() || jobData.isMissingNode()) {
            return null;
        }
        if (jobData.isTextual()) {
            return jobData.asText();
        }
        return jobData.toString();
    }

    /**
     * Stored job data as JSON; text that is not valid JSON is returned as a string node
     */
    default JsonNode textToJobData(String jobData) {
        if (jobData == null) {
            return null;
        }
        try {
            return JOB_DATA_READER.readTree(jobData);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(jobData);
        }
    }
}
