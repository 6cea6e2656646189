package com.poc.vmmigration.controller;

import com.poc.vmmigration.model.Workload;
import com.poc.vmmigration.model.WorkloadRequest;
import com.poc.vmmigration.model.WorkloadUpdateRequest;
import com.poc.vmmigration.service.WorkloadService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for source workloads.
 * Exception handling is centralized in GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/workloads")
@RequiredArgsConstructor
@Slf4j
public class WorkloadController {

    private final WorkloadService workloadService;

    @PostMapping
    public ResponseEntity<Workload> createWorkload(@Valid @RequestBody WorkloadRequest request) {
        log.info("Received workload registration request: {}", request.getIp());
        return ResponseEntity.status(HttpStatus.CREATED).body(workloadService.createWorkload(request));
    }

    @GetMapping("/{ip}")
    public ResponseEntity<Workload> getWorkload(@PathVariable String ip) {
        log.debug("Getting workload: {}", ip);
        return ResponseEntity.ok(workloadService.getWorkload(ip));
    }

    @GetMapping
    public ResponseEntity<List<Workload>> listWorkloads() {
        return ResponseEntity.ok(workloadService.listWorkloads());
    }

    /**
     * Update credentials and/or storage. The IP cannot be modified.
     */
    @PutMapping("/{ip}")
    public ResponseEntity<Workload> updateWorkload(
            @PathVariable String ip, @Valid @RequestBody WorkloadUpdateRequest request) {
        log.info("Received workload update request: {}", ip);
        return ResponseEntity.ok(workloadService.updateWorkload(ip, request));
    }

    @DeleteMapping("/{ip}")
    public ResponseEntity<Void> deleteWorkload(@PathVariable String ip) {
        workloadService.deleteWorkload(ip);
        return ResponseEntity.noContent().build();
    }
}
