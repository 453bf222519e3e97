package com.devicepush.orchestrator.application.controller;

import com.devicepush.orchestrator.application.dto.PushAckRequest;
import com.devicepush.orchestrator.domain.service.AcknowledgmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/push")
@RequiredArgsConstructor
public class PushAckController {

    private final AcknowledgmentService acknowledgmentService;

    @PostMapping("/ack")
    public ResponseEntity<Map<String, Object>> acknowledge(@Valid @RequestBody PushAckRequest request) {
        return ResponseEntity.ok(acknowledgmentService.acknowledge(request));
    }
}
