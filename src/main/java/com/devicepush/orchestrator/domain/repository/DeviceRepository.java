package com.devicepush.orchestrator.domain.repository;

import com.devicepush.orchestrator.domain.model.Device;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DeviceRepository extends JpaRepository<Device, Long> {

    Optional<Device> findByDeviceId(String deviceId);

    List<Device> findBySiteIdAndSegmentAndActiveTrue(String siteId, String segment);
}
