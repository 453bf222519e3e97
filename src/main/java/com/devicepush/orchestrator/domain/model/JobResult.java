package com.devicepush.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Aggregate outcome stored on a job once it reaches a terminal state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobResult {

    public static final String NO_DEVICES = "no_devices";

    private String status;
    private String message;
    private int total;
    private int successful;
    private int failed;
    @Builder.Default
    private List<DeviceOutcome> devices = new ArrayList<>();
    private Map<String, Object> pushPayload;

    public static JobResult noDevices(String target) {
        return JobResult.builder()
                .status(NO_DEVICES)
                .message("No " + target + " devices found")
                .build();
    }

    public static JobResult fromOutcomes(List<DeviceOutcome> outcomes, Map<String, Object> pushPayload) {
        int successful = (int) outcomes.stream().filter(DeviceOutcome::isSent).count();
        return JobResult.builder()
                .total(outcomes.size())
                .successful(successful)
                .failed(outcomes.size() - successful)
                .devices(new ArrayList<>(outcomes))
                .pushPayload(pushPayload)
                .build();
    }
}
