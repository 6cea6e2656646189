package com.poc.vmmigration.controller;

import com.poc.vmmigration.model.Migration;
import com.poc.vmmigration.model.MigrationRequest;
import com.poc.vmmigration.model.MigrationStatus;
import com.poc.vmmigration.model.MigrationUpdateRequest;
import com.poc.vmmigration.model.StartMigrationRequest;
import com.poc.vmmigration.service.MigrationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for migration operations.
 * Exception handling is centralized in GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/migrations")
@RequiredArgsConstructor
@Slf4j
public class MigrationController {

    private final MigrationService migrationService;

    @PostMapping
    public ResponseEntity<Migration> createMigration(@Valid @RequestBody MigrationRequest request) {
        log.info("Received migration creation request for source: {}",
                request.getSource() != null ? request.getSource().getIp() : request.getSourceIp());

        Migration migration = migrationService.createMigration(request);

        log.info("Migration created with ID: {}", migration.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(migration);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Migration> getMigration(@PathVariable String id) {
        log.debug("Getting migration: {}", id);
        return ResponseEntity.ok(migrationService.getMigration(id));
    }

    @GetMapping
    public ResponseEntity<List<Migration>> listMigrations() {
        return ResponseEntity.ok(migrationService.listMigrations());
    }

    @PutMapping("/{id}")
    public ResponseEntity<Migration> updateMigration(
            @PathVariable String id, @Valid @RequestBody MigrationUpdateRequest request) {
        log.info("Received migration update request: {}", id);
        return ResponseEntity.ok(migrationService.updateMigration(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteMigration(@PathVariable String id) {
        migrationService.deleteMigration(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * Start a migration. Blocks until it finishes unless {@code async} is set,
     * in which case it returns 202 as soon as the migration is running.
     */
    @PostMapping("/{id}/start")
    public ResponseEntity<Migration> startMigration(
            @PathVariable String id, @Valid @RequestBody(required = false) StartMigrationRequest request) {
        log.info("Received start request for migration: {}", id);

        if (request != null && request.isAsync()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(migrationService.startMigrationAsync(id, request));
        }
        return ResponseEntity.ok(migrationService.startMigration(id, request));
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<MigrationStatus> getMigrationStatus(@PathVariable String id) {
        log.debug("Getting status for migration: {}", id);
        return ResponseEntity.ok(migrationService.getStatus(id));
    }
}
