package com.devicepush.orchestrator.config;

import com.devicepush.orchestrator.push.PushPlatform;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@ConfigurationProperties(prefix = "orchestrator")
@Data
@Validated
public class OrchestratorProperties {

    private final Workers workers = new Workers();
    private final Jobs jobs = new Jobs();
    private final Delivery delivery = new Delivery();

    @Data
    public static class Workers {
        @Positive
        private int maxConcurrentJobs = 10;
        @NotNull
        private Duration pollTimeout = Duration.ofSeconds(1);
        @NotNull
        private Duration shutdownGracePeriod = Duration.ofSeconds(30);
        private boolean autoStart = true;
    }

    @Data
    public static class Jobs {
        @Positive
        private int defaultTtlSeconds = 300;
        @NotBlank
        private String defaultSegment = "pos-terminals";
        @NotBlank
        private String configBaseUrl = "https://config.devicepush.local";
        @Positive
        private int recentJobsLimit = 10;
    }

    @Data
    public static class Delivery {
        @NotNull
        private PushPlatform defaultPlatform = PushPlatform.FCM;
    }
}
