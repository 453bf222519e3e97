package com.devicepush.orchestrator.application.dto;

import com.devicepush.orchestrator.domain.model.Job;
import com.devicepush.orchestrator.domain.model.JobPriority;
import com.devicepush.orchestrator.domain.model.JobResult;
import com.devicepush.orchestrator.domain.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Read-only view of a job.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(String jobId,
                          String action,
                          String description,
                          JobStatus status,
                          JobPriority priority,
                          String siteId,
                          String segment,
                          String deviceId,
                          String configUrl,
                          String configVersion,
                          Instant createdAt,
                          Instant updatedAt,
                          Instant startedAt,
                          Instant completedAt,
                          JobResult result,
                          String errorMessage) {

    public static JobResponse from(Job job) {
        return new JobResponse(job.getJobId(), job.getAction(), job.getDescription(), job.getStatus(),
                job.getPriority(), job.getSiteId(), job.getSegment(), job.getDeviceId(), job.getConfigUrl(),
                job.getConfigVersion(), job.getCreatedAt(), job.getUpdatedAt(), job.getStartedAt(),
                job.getCompletedAt(), job.getResult(), job.getErrorMessage());
    }
}
