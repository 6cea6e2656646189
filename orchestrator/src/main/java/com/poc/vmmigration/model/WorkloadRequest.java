package com.poc.vmmigration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering a source workload.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkloadRequest {

    @NotBlank(message = "Workload IP is required")
    private String ip;

    @NotNull(message = "Credentials are required")
    private Credentials credentials;

    /**
     * Optional; an empty storage is used when absent.
     */
    private Storage storage;

    public Workload toWorkload() {
        return new Workload(ip, credentials, storage);
    }
}
