package com.devicepush.orchestrator.domain.service;

import com.devicepush.orchestrator.domain.model.Device;
import com.devicepush.orchestrator.domain.model.DeviceOutcome;
import com.devicepush.orchestrator.domain.model.Job;
import com.devicepush.orchestrator.domain.model.JobResult;
import com.devicepush.orchestrator.domain.model.JobStatus;
import com.devicepush.orchestrator.domain.model.PushNotification;
import com.devicepush.orchestrator.domain.repository.DeviceRepository;
import com.devicepush.orchestrator.domain.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Processes one dequeued job: resolve targets, fan the notification out device by device, finalize the job.
 * A device failure never aborts the remaining devices and nothing is retried within a job.
 */
@Component
@RequiredArgsConstructor
public class JobWorker {

    private final JobRepository jobRepository;
    private final DeviceRepository deviceRepository;
    private final PushDeliveryService pushDeliveryService;
    private final Clock clock;
    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    public void process(String jobId, String workerName) {
        Optional<Job> loaded = jobRepository.findByJobId(jobId);
        if (loaded.isEmpty()) {
            log.warn("JOB_MISSING - Dequeued job no longer exists [jobId={}, worker={}]", jobId, workerName);
            return;
        }
        Job job = loaded.get();
        if (job.getStatus() != JobStatus.QUEUED) {
            log.info("JOB_SKIPPED - Dequeued job is not queued anymore [jobId={}, status={}, worker={}]", jobId, job.getStatus(), workerName);
            return;
        }

        try {
            job.markSent(clock.instant());
            job = jobRepository.save(job);
            log.info("JOB_STARTED - Worker picked up job [jobId={}, worker={}, siteId={}, segment={}, deviceId={}]",
                    jobId, workerName, job.getSiteId(), job.getSegment(), job.getDeviceId());

            List<Device> devices = resolveDevices(job);
            if (devices.isEmpty()) {
                String target = job.isDeviceScoped() ? job.getDeviceId() : job.getSegment();
                job.markCompleted(JobResult.noDevices(target), clock.instant());
                jobRepository.save(job);
                log.info("JOB_NO_DEVICES - No target devices, job completed [jobId={}, target={}]", jobId, target);
                return;
            }

            PushNotification notification = new PushNotification(job.getConfigUrl(), job.getConfigVersion(),
                    job.getTtlSeconds(), job.getCollapseKey(), job.getPriority().toPushPriority(), clock.instant());

            List<DeviceOutcome> outcomes = new ArrayList<>(devices.size());
            for (Device device : devices) {
                outcomes.add(deliverIsolated(job, device, notification));
            }

            JobResult result = JobResult.fromOutcomes(outcomes, notification.toMap());
            if (result.getFailed() == 0) {
                job.markAcknowledged(result, clock.instant());
                log.info("JOB_ACKNOWLEDGED - All pushes sent [jobId={}, total={}]", jobId, result.getTotal());
            } else {
                String message = "Failed to send push to " + result.getFailed() + "/" + result.getTotal() + " devices";
                job.markFailed(result, message, clock.instant());
                log.warn("JOB_PARTIAL_FAILURE - {} [jobId={}, successful={}]", message, jobId, result.getSuccessful());
            }
            jobRepository.save(job);
        } catch (Exception e) {
            log.error("JOB_ERROR - Job processing failed [jobId={}, worker={}, error={}]", jobId, workerName, e.getMessage(), e);
            markFailed(jobId, e);
        }
    }

    private List<Device> resolveDevices(Job job) {
        if (job.isDeviceScoped()) {
            return deviceRepository.findByDeviceId(job.getDeviceId())
                    .filter(Device::isActive)
                    .map(List::of)
                    .orElse(List.of());
        }
        return deviceRepository.findBySiteIdAndSegmentAndActiveTrue(job.getSiteId(), job.getSegment());
    }

    private DeviceOutcome deliverIsolated(Job job, Device device, PushNotification notification) {
        try {
            return pushDeliveryService.deliver(job, device, notification);
        } catch (Exception e) {
            log.error("DEVICE_DELIVERY_ERROR - Delivery raised [jobId={}, deviceId={}, error={}]", job.getJobId(), device.getDeviceId(), e.getMessage(), e);
            return DeviceOutcome.builder()
                    .deviceId(device.getDeviceId())
                    .platform(device.getPlatform() != null ? device.getPlatform().key() : null)
                    .status(DeviceOutcome.ERROR)
                    .detail(e.getMessage())
                    .timestamp(clock.instant())
                    .build();
        }
    }

    /**
     * Reloads the job so a concurrent cancellation is seen; jobs already terminal are left as they are.
     */
    private void markFailed(String jobId, Exception cause) {
        try {
            Optional<Job> current = jobRepository.findByJobId(jobId);
            if (current.isEmpty() || current.get().getStatus().isTerminal()) {
                log.warn("JOB_FAIL_SKIPPED - Job already finalized [jobId={}, status={}]",
                        jobId, current.map(Job::getStatus).orElse(null));
                return;
            }
            Job job = current.get();
            job.markFailed(null, cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), clock.instant());
            jobRepository.save(job);
        } catch (RuntimeException e) {
            log.error("JOB_FAIL_PERSIST_ERROR - Could not record job failure [jobId={}, error={}]", jobId, e.getMessage(), e);
        }
    }
}
