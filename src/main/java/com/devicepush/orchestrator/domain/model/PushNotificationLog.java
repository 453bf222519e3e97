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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * One row per delivery attempt. {@code messageId} is the tracking id embedded in the notification data and
 * echoed back by the device when it acknowledges.
 */
@Entity
@Table(name = "push_notification_logs", indexes = {
        @Index(name = "idx_push_logs_job_id", columnList = "job_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PushNotificationLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "message_id", nullable = false, unique = true, length = 64)
    private String messageId;

    @Column(name = "job_id")
    private String jobId;

    @Column(name = "device_id", nullable = false)
    private String deviceId;

    @Column(name = "provider", nullable = false, length = 16)
    private String provider;

    @Column(name = "provider_message_id")
    private String providerMessageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PushDeliveryStatus status;

    @Column(name = "error_code")
    private String errorCode;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;

    @Column(name = "received_at")
    private Instant receivedAt;

    @Column(name = "latency_ms")
    private Long latencyMs;

    public boolean isAcknowledged() {
        return receivedAt != null;
    }

    /**
     * Delivery latency for an acknowledgment received at {@code ackReceivedAt}, clamped at zero when the device
     * clock runs behind.
     */
    public long latencyUntil(Instant ackReceivedAt) {
        return Math.max(0L, Duration.between(sentAt, ackReceivedAt).toMillis());
    }
}
