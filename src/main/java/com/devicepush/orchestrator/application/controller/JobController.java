package com.devicepush.orchestrator.application.controller;

import com.devicepush.orchestrator.application.dto.CreateJobRequest;
import com.devicepush.orchestrator.application.dto.JobResponse;
import com.devicepush.orchestrator.domain.exception.JobNotFoundException;
import com.devicepush.orchestrator.domain.service.JobOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobOrchestrator jobOrchestrator;
    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody CreateJobRequest request) {
        log.info("Create job: siteId={}, action={}, deviceId={}, segment={}", request.getSiteId(), request.getAction(), request.getDeviceId(), request.getSegment());
        String jobId = jobOrchestrator.createJob(request);
        Map<String, Object> resp = new HashMap<>();
        resp.put("job_id", jobId);
        resp.put("status", "queued");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(resp);
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<JobResponse> status(@PathVariable String jobId) {
        return jobOrchestrator.getJobStatus(jobId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @GetMapping
    public List<JobResponse> recent(@RequestParam(name = "limit", defaultValue = "0") int limit) {
        return jobOrchestrator.getRecentJobs(limit);
    }

    @PostMapping("/{jobId}/cancel")
    public JobResponse cancel(@PathVariable String jobId) {
        log.info("Cancel job: jobId={}", jobId);
        return jobOrchestrator.cancelJob(jobId);
    }
}
