package com.devicepush.orchestrator.domain.service;

import com.devicepush.orchestrator.application.dto.CreateJobRequest;
import com.devicepush.orchestrator.application.dto.JobResponse;
import com.devicepush.orchestrator.config.OrchestratorProperties;
import com.devicepush.orchestrator.domain.exception.InvalidJobStateException;
import com.devicepush.orchestrator.domain.exception.JobNotFoundException;
import com.devicepush.orchestrator.domain.exception.TargetNotFoundException;
import com.devicepush.orchestrator.domain.model.Device;
import com.devicepush.orchestrator.domain.model.Job;
import com.devicepush.orchestrator.domain.model.JobPriority;
import com.devicepush.orchestrator.domain.repository.DeviceRepository;
import com.devicepush.orchestrator.domain.repository.JobRepository;
import com.devicepush.orchestrator.domain.repository.SiteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Accepts configuration jobs and runs them on a fixed pool of workers fed by a FIFO queue.
 *
 * <p>Jobs are persisted before they are queued, so callers can poll their status as soon as
 * {@link #createJob(CreateJobRequest)} returns. Stopping lets in-flight jobs finish within the configured grace
 * period; jobs still waiting in the queue stay {@code QUEUED} in the store.
 */
@Service
public class JobOrchestrator implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);
    private static final DateTimeFormatter VERSION_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final JobRepository jobRepository;
    private final SiteRepository siteRepository;
    private final DeviceRepository deviceRepository;
    private final JobWorker jobWorker;
    private final OrchestratorProperties properties;
    private final Clock clock;

    private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();
    private final Object lifecycleLock = new Object();
    private volatile boolean running;
    private ExecutorService workers;

    public JobOrchestrator(JobRepository jobRepository, SiteRepository siteRepository, DeviceRepository deviceRepository,
                           JobWorker jobWorker, OrchestratorProperties properties, Clock clock) {
        this.jobRepository = jobRepository;
        this.siteRepository = siteRepository;
        this.deviceRepository = deviceRepository;
        this.jobWorker = jobWorker;
        this.properties = properties;
        this.clock = clock;
    }

    public String createJob(CreateJobRequest request) {
        String siteId = request.getSiteId();
        if (!siteRepository.existsBySiteId(siteId)) {
            throw new TargetNotFoundException("Site " + siteId + " not found");
        }
        boolean deviceScoped = request.getDeviceId() != null && !request.getDeviceId().isBlank();
        if (deviceScoped) {
            Optional<Device> device = deviceRepository.findByDeviceId(request.getDeviceId());
            if (device.isEmpty() || !siteId.equals(device.get().getSiteId())) {
                throw new TargetNotFoundException("Device " + request.getDeviceId() + " not found in site " + siteId);
            }
        }

        OrchestratorProperties.Jobs defaults = properties.getJobs();
        Instant now = clock.instant();
        String segment = deviceScoped ? request.getSegment() : firstNonBlank(request.getSegment(), defaults.getDefaultSegment());
        String version = firstNonBlank(request.getConfigVersion(), "v" + VERSION_FORMAT.format(now));
        String targetPath = deviceScoped ? request.getDeviceId() : segment;
        String configUrl = firstNonBlank(request.getConfigUrl(),
                defaults.getConfigBaseUrl() + "/" + siteId + "/" + targetPath + "/" + version + ".json");

        Map<String, String> payload = new HashMap<>();
        payload.put("action", request.getAction());
        payload.put("site_id", siteId);
        if (segment != null) {
            payload.put("segment", segment);
        }
        if (deviceScoped) {
            payload.put("device_id", request.getDeviceId());
        }

        Job job = Job.builder()
                .jobId("job-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8))
                .action(request.getAction())
                .description(firstNonBlank(request.getDescription(), "Update configuration for " + siteId))
                .priority(request.getPriority() != null ? request.getPriority() : JobPriority.HIGH)
                .siteId(siteId)
                .segment(segment)
                .deviceId(deviceScoped ? request.getDeviceId() : null)
                .configUrl(configUrl)
                .configVersion(version)
                .ttlSeconds(defaults.getDefaultTtlSeconds())
                .collapseKey("config-" + (deviceScoped ? request.getDeviceId() : siteId))
                .payload(payload)
                .createdAt(now)
                .updatedAt(now)
                .build();
        job = jobRepository.save(job);
        log.info("JOB_CREATED - Job persisted [jobId={}, action={}, siteId={}, segment={}, deviceId={}, version={}]",
                job.getJobId(), job.getAction(), siteId, segment, job.getDeviceId(), version);

        job.markQueued(clock.instant());
        job = jobRepository.save(job);
        queue.add(job.getJobId());
        log.info("JOB_QUEUED - Job admitted to queue [jobId={}, queueDepth={}]", job.getJobId(), queue.size());
        return job.getJobId();
    }

    public Optional<JobResponse> getJobStatus(String jobId) {
        return jobRepository.findByJobId(jobId).map(JobResponse::from);
    }

    public List<JobResponse> getRecentJobs(int limit) {
        int size = limit > 0 ? limit : properties.getJobs().getRecentJobsLimit();
        return jobRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, size)).stream()
                .map(JobResponse::from)
                .toList();
    }

    /**
     * External cancellation. A queued job that is cancelled is skipped when a worker dequeues it.
     */
    public JobResponse cancelJob(String jobId) {
        Job job = jobRepository.findByJobId(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.getStatus().isTerminal()) {
            throw new InvalidJobStateException("Job " + jobId + " is already " + job.getStatus());
        }
        job.cancel("Cancelled by operator", clock.instant());
        job = jobRepository.save(job);
        log.info("JOB_CANCELLED - Job cancelled [jobId={}]", jobId);
        return JobResponse.from(job);
    }

    public int queueDepth() {
        return queue.size();
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            int workerCount = properties.getWorkers().getMaxConcurrentJobs();
            workers = Executors.newFixedThreadPool(workerCount, new CustomizableThreadFactory("job-worker-"));
            running = true;
            for (int i = 0; i < workerCount; i++) {
                String workerName = "worker-" + i;
                workers.execute(() -> workerLoop(workerName));
            }
            log.info("ORCHESTRATOR_STARTED - Worker pool started [workers={}]", workerCount);
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            workers.shutdown();
            long graceMillis = properties.getWorkers().getShutdownGracePeriod().toMillis();
            try {
                if (!workers.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                    log.warn("ORCHESTRATOR_STOP_TIMEOUT - In-flight jobs did not finish within grace period, interrupting [graceMillis={}]", graceMillis);
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("ORCHESTRATOR_STOPPED - Worker pool stopped [jobsLeftInQueue={}]", queue.size());
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getWorkers().isAutoStart();
    }

    private void workerLoop(String workerName) {
        long pollMillis = properties.getWorkers().getPollTimeout().toMillis();
        log.debug("Worker started [worker={}]", workerName);
        while (running) {
            String jobId;
            try {
                jobId = queue.poll(pollMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (jobId == null) {
                continue;
            }
            try {
                jobWorker.process(jobId, workerName);
            } catch (RuntimeException e) {
                log.error("WORKER_ERROR - Unhandled error while processing job [worker={}, jobId={}, error={}]", workerName, jobId, e.getMessage(), e);
            }
        }
        log.debug("Worker stopped [worker={}]", workerName);
    }

    private static String firstNonBlank(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
