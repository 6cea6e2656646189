package com.poc.vmmigration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for replacing the selected mount points of a migration.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MigrationUpdateRequest {

    @NotNull(message = "Selected mount points are required")
    private List<MountPoint> selectedMountPoints;
}
