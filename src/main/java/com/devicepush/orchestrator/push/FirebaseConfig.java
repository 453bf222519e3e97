package com.devicepush.orchestrator.push;

import com.devicepush.orchestrator.push.auth.ServiceAccountAuthenticator;
import com.devicepush.orchestrator.push.fcm.FcmDeliveryProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.messaging.FirebaseMessaging;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileInputStream;
import java.io.IOException;
import java.time.Clock;

@Configuration
@ConditionalOnProperty(prefix = "push.fcm", name = "enabled", havingValue = "true")
public class FirebaseConfig {

    private static final Logger log = LoggerFactory.getLogger(FirebaseConfig.class);
    static final String MESSAGING_SCOPE = "https://www.googleapis.com/auth/firebase.messaging";

    @Bean
    public GoogleCredentials firebaseCredentials(@Value("${push.fcm.service-account-path:}") String serviceAccountPath) {
        try {
            if (serviceAccountPath == null || serviceAccountPath.isBlank()) {
                log.warn("No service account path provided, using application default credentials");
                return GoogleCredentials.getApplicationDefault().createScoped(MESSAGING_SCOPE);
            }
            try (FileInputStream serviceAccount = new FileInputStream(serviceAccountPath)) {
                log.info("Loading Firebase service account from: {}", serviceAccountPath);
                return GoogleCredentials.fromStream(serviceAccount).createScoped(MESSAGING_SCOPE);
            }
        } catch (IOException e) {
            throw new PushConfigurationException("Unable to load Firebase credentials: " + e.getMessage(), e);
        }
    }

    @Bean
    public FirebaseApp firebaseApp(GoogleCredentials firebaseCredentials,
                                   @Value("${push.fcm.project-id:}") String projectId) {
        if (!FirebaseApp.getApps().isEmpty()) {
            return FirebaseApp.getInstance();
        }
        FirebaseOptions.Builder options = FirebaseOptions.builder().setCredentials(firebaseCredentials);
        if (projectId != null && !projectId.isBlank()) {
            options.setProjectId(projectId);
        }
        FirebaseApp app = FirebaseApp.initializeApp(options.build());
        log.info("Firebase App initialized [projectId={}]", projectId);
        return app;
    }

    @Bean
    public ServiceAccountAuthenticator fcmAuthenticator(GoogleCredentials firebaseCredentials,
                                                        @Value("${push.auth.refresh-buffer-seconds:300}") long refreshBufferSeconds,
                                                        Clock clock) {
        return new ServiceAccountAuthenticator(firebaseCredentials, clock, refreshBufferSeconds);
    }

    @Bean
    public FcmDeliveryProvider fcmDeliveryProvider(FirebaseApp app,
                                                   ServiceAccountAuthenticator fcmAuthenticator,
                                                   @Value("${push.fcm.project-id:}") String projectId,
                                                   ObjectMapper objectMapper,
                                                   Clock clock) {
        return new FcmDeliveryProvider(FirebaseMessaging.getInstance(app), fcmAuthenticator, objectMapper, projectId, clock);
    }
}
