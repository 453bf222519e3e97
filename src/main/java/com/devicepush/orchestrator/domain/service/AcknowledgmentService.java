package com.devicepush.orchestrator.domain.service;

import com.devicepush.orchestrator.application.dto.PushAckRequest;
import com.devicepush.orchestrator.domain.model.PushDeliveryStatus;
import com.devicepush.orchestrator.domain.model.PushNotificationLog;
import com.devicepush.orchestrator.domain.repository.PushNotificationLogRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Matches device acknowledgments to delivery log rows. Only the first acknowledgment of a message is recorded, also
 * when two arrive at once; repeated or unknown acknowledgments are accepted without effect.
 */
@Service
@RequiredArgsConstructor
public class AcknowledgmentService {

    static final Map<String, Object> ACKNOWLEDGED = Map.of("status", "acknowledged");

    private final PushNotificationLogRepository logRepository;
    private final Clock clock;
    private static final Logger log = LoggerFactory.getLogger(AcknowledgmentService.class);

    @Transactional
    public Map<String, Object> acknowledge(PushAckRequest ack) {
        Optional<PushNotificationLog> entry = logRepository.findByMessageId(ack.getMessageId());
        if (entry.isEmpty()) {
            log.debug("PUSH_ACK_UNKNOWN - Acknowledgment for unknown message [messageId={}, deviceId={}]", ack.getMessageId(), ack.getDeviceId());
            return ACKNOWLEDGED;
        }
        PushNotificationLog notificationLog = entry.get();
        if (notificationLog.isAcknowledged()) {
            log.debug("PUSH_ACK_DUPLICATE - Message already acknowledged [messageId={}, receivedAt={}]", ack.getMessageId(), notificationLog.getReceivedAt());
            return ACKNOWLEDGED;
        }
        if (ack.getDeviceId() != null && !ack.getDeviceId().equals(notificationLog.getDeviceId())) {
            log.warn("PUSH_ACK_DEVICE_MISMATCH - Acknowledging device differs from target [messageId={}, expected={}, actual={}]",
                    ack.getMessageId(), notificationLog.getDeviceId(), ack.getDeviceId());
        }
        Instant receivedAt = ack.getReceivedAt() != null ? ack.getReceivedAt() : clock.instant();
        PushDeliveryStatus status = PushDeliveryStatus.fromAck(ack.getStatus());
        long latencyMs = notificationLog.latencyUntil(receivedAt);
        if (logRepository.acknowledgeIfPending(ack.getMessageId(), status, receivedAt, latencyMs) == 0) {
            log.debug("PUSH_ACK_DUPLICATE - Concurrent acknowledgment already recorded [messageId={}]", ack.getMessageId());
            return ACKNOWLEDGED;
        }
        log.info("PUSH_ACK - Delivery acknowledged [messageId={}, deviceId={}, status={}, latencyMs={}]",
                ack.getMessageId(), notificationLog.getDeviceId(), status, latencyMs);
        return ACKNOWLEDGED;
    }
}
