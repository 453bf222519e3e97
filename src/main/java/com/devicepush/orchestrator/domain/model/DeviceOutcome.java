package com.devicepush.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-device entry of a {@link JobResult}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeviceOutcome {

    public static final String SENT = "sent";
    public static final String FAILED = "failed";
    public static final String ERROR = "error";

    private String deviceId;
    private String platform;
    private String status;
    private String messageId;
    private String errorCode;
    private String detail;
    private Instant timestamp;

    public boolean isSent() {
        return SENT.equals(status);
    }
}
