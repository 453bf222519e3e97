package com.devicepush.orchestrator.domain.model;

import com.devicepush.orchestrator.push.PushPlatform;
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

/**
 * Registered endpoint device. {@code pushToken} is platform-specific: a registration token, a WNS channel URI,
 * a JSON web push subscription or an MQTT topic.
 */
@Entity
@Table(name = "devices", indexes = {
        @Index(name = "idx_devices_site_segment", columnList = "site_id, segment")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Device {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_id", nullable = false, unique = true)
    private String deviceId;

    @Column(name = "site_id", nullable = false)
    private String siteId;

    @Column(name = "segment")
    private String segment;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform", length = 16)
    private PushPlatform platform;

    @Column(name = "push_token", length = 4096)
    private String pushToken;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;
}
