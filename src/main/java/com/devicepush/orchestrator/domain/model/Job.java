package com.devicepush.orchestrator.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration-change job. Status changes only through the transition methods, which enforce
 * {@link JobStatus#canTransitionTo(JobStatus)}.
 */
@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "idx_jobs_status", columnList = "status"),
        @Index(name = "idx_jobs_site_id", columnList = "site_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, unique = true, length = 32)
    private String jobId;

    @Column(name = "action", nullable = false)
    private String action;

    @Column(name = "description")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16)
    @Builder.Default
    private JobPriority priority = JobPriority.HIGH;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "site_id", nullable = false)
    private String siteId;

    @Column(name = "segment")
    private String segment;

    @Column(name = "device_id")
    private String deviceId;

    @Column(name = "config_url", nullable = false)
    private String configUrl;

    @Column(name = "config_version", nullable = false)
    private String configVersion;

    @Column(name = "ttl_seconds", nullable = false)
    private int ttlSeconds;

    @Column(name = "collapse_key")
    private String collapseKey;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload")
    @Builder.Default
    private Map<String, String> payload = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result")
    private JobResult result;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean isDeviceScoped() {
        return deviceId != null && !deviceId.isBlank();
    }

    public void markQueued(Instant now) {
        transitionTo(JobStatus.QUEUED, now);
    }

    public void markSent(Instant now) {
        transitionTo(JobStatus.SENT, now);
        if (startedAt == null) {
            startedAt = now;
        }
    }

    public void markAcknowledged(JobResult jobResult, Instant now) {
        finish(JobStatus.ACKNOWLEDGED, jobResult, null, now);
    }

    public void markCompleted(JobResult jobResult, Instant now) {
        finish(JobStatus.COMPLETED, jobResult, null, now);
    }

    public void markFailed(JobResult jobResult, String message, Instant now) {
        finish(JobStatus.FAILED, jobResult, message, now);
    }

    public void cancel(String reason, Instant now) {
        finish(JobStatus.CANCELLED, null, reason, now);
    }

    private void finish(JobStatus terminal, JobResult jobResult, String message, Instant now) {
        transitionTo(terminal, now);
        this.result = jobResult;
        this.errorMessage = message;
        if (completedAt == null) {
            // completed_at never precedes started_at
            completedAt = startedAt != null && now.isBefore(startedAt) ? startedAt : now;
        }
    }

    private void transitionTo(JobStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + jobId + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        this.updatedAt = now;
    }
}
