package com.devicepush.orchestrator.domain.repository;

import com.devicepush.orchestrator.domain.model.PushDeliveryStatus;
import com.devicepush.orchestrator.domain.model.PushNotificationLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface PushNotificationLogRepository extends JpaRepository<PushNotificationLog, Long> {

    Optional<PushNotificationLog> findByMessageId(String messageId);

    /**
     * Records an acknowledgment only while the row has none. Returns 0 when another acknowledgment got there first.
     */
    @Modifying
    @Query("""
            update PushNotificationLog l
               set l.status = :status, l.receivedAt = :receivedAt, l.latencyMs = :latencyMs
             where l.messageId = :messageId and l.receivedAt is null
            """)
    int acknowledgeIfPending(@Param("messageId") String messageId,
                             @Param("status") PushDeliveryStatus status,
                             @Param("receivedAt") Instant receivedAt,
                             @Param("latencyMs") long latencyMs);
}
