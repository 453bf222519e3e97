package com.devicepush.orchestrator.application.dto;

import com.devicepush.orchestrator.push.PushPriority;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Direct send to one device token, a list of tokens, or a topic.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SendNotificationRequest {
    @NotBlank
    private String platform;
    private String deviceToken;
    private List<String> deviceTokens;
    private String topic;
    @NotBlank
    private String title;
    @NotBlank
    private String body;
    private Map<String, String> data;
    private PushPriority priority;
    private Integer ttlSeconds;
    private String collapseKey;
    private Map<String, String> platformData;
}
