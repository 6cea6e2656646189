package com.poc.vmmigration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.poc.vmmigration.exception.InvalidArgumentException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Cloud destination of a migration.
 * The target VM's storage is filled in by a successful migration run.
 */
@Getter
@EqualsAndHashCode
@ToString
public class MigrationTarget {

    @JsonProperty("cloud_type")
    private final CloudType cloudType;

    @JsonProperty("cloud_credentials")
    private final Credentials cloudCredentials;

    @JsonProperty("target_vm")
    private final Workload targetVm;

    @JsonCreator
    public MigrationTarget(
            @JsonProperty("cloud_type") CloudType cloudType,
            @JsonProperty("cloud_credentials") Credentials cloudCredentials,
            @JsonProperty("target_vm") Workload targetVm) {
        if (cloudType == null) {
            throw new InvalidArgumentException("Cloud type is required");
        }
        if (cloudCredentials == null) {
            throw new InvalidArgumentException("Cloud credentials are required");
        }
        if (targetVm == null) {
            throw new InvalidArgumentException("Target VM is required");
        }
        this.cloudType = cloudType;
        this.cloudCredentials = cloudCredentials;
        this.targetVm = targetVm;
    }
}
