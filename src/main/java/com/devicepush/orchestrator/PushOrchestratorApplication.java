package com.devicepush.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PushOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PushOrchestratorApplication.class, args);
    }
}
