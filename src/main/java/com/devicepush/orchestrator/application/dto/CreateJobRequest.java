package com.devicepush.orchestrator.application.dto;

import com.devicepush.orchestrator.domain.model.JobPriority;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateJobRequest {
    @NotBlank
    private String siteId;
    @NotBlank
    private String action;
    private String description;
    private String configUrl;
    private String configVersion;
    private String deviceId;
    private String segment;
    private JobPriority priority;
}
