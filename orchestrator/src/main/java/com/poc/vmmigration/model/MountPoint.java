package com.poc.vmmigration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.poc.vmmigration.exception.InvalidArgumentException;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Storage mount point with size information.
 */
@EqualsAndHashCode
@ToString
public final class MountPoint {

    private final String name;
    private final long totalSize;

    @JsonCreator
    public MountPoint(
            @JsonProperty("mount_point_name") String name,
            @JsonProperty("total_size") Long totalSize) {
        if (StringUtils.isEmpty(name)) {
            throw new InvalidArgumentException("Mount point name cannot be null or empty");
        }
        if (totalSize == null) {
            throw new InvalidArgumentException("Total size is required for mount point: " + name);
        }
        if (totalSize < 0) {
            throw new InvalidArgumentException("Total size cannot be negative: " + totalSize);
        }
        this.name = name;
        this.totalSize = totalSize;
    }

    public MountPoint(String name, long totalSize) {
        this(name, Long.valueOf(totalSize));
    }

    @JsonProperty("mount_point_name")
    public String getName() {
        return name;
    }

    @JsonProperty("total_size")
    public long getTotalSize() {
        return totalSize;
    }

    /**
     * Returns an independent copy of this mount point.
     */
    public MountPoint copy() {
        return new MountPoint(name, totalSize);
    }
}
