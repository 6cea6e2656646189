package com.poc.vmmigration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for updating a workload. Absent fields are left unchanged.
 * The IP may be repeated but not changed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkloadUpdateRequest {

    private String ip;

    private Credentials credentials;

    private Storage storage;
}
