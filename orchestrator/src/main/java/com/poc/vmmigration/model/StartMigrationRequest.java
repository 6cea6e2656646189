package com.poc.vmmigration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for starting a migration. Both fields are optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class StartMigrationRequest {

    /**
     * Simulated transfer time in minutes; the configured default applies when absent.
     */
    @PositiveOrZero(message = "Delay must not be negative")
    private Double delayMinutes;

    /**
     * Return as soon as the migration is running instead of waiting for it to finish.
     */
    private boolean async;
}
