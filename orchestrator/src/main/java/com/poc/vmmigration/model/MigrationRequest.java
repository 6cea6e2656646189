package com.poc.vmmigration.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for creating a migration.
 * The source is either given inline or referenced by the IP of a registered workload.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class MigrationRequest {

    @NotNull(message = "Selected mount points are required")
    private List<MountPoint> selectedMountPoints;

    private Workload source;

    /**
     * IP of a registered workload to copy as the source.
     */
    private String sourceIp;

    @NotNull(message = "Migration target is required")
    private MigrationTarget migrationTarget;

    @JsonIgnore
    @AssertTrue(message = "Exactly one of source or source_ip is required")
    public boolean isSourceSpecified() {
        return (source == null) != (sourceIp == null || sourceIp.isBlank());
    }
}
