package com.poc.vmmigration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.poc.vmmigration.exception.InvalidArgumentException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Storage container with multiple mount points.
 * Mount point names are not required to be unique; lookups return the first match.
 */
@EqualsAndHashCode
@ToString
public class Storage {

    private final List<MountPoint> mountPoints = new ArrayList<>();

    public Storage() {
    }

    @JsonCreator
    public Storage(@JsonProperty("mount_points") List<MountPoint> mountPoints) {
        if (mountPoints != null) {
            mountPoints.forEach(this::addMountPoint);
        }
    }

    @JsonProperty("mount_points")
    public List<MountPoint> getMountPoints() {
        return Collections.unmodifiableList(mountPoints);
    }

    public void addMountPoint(MountPoint mountPoint) {
        if (mountPoint == null) {
            throw new InvalidArgumentException("Mount point cannot be null");
        }
        mountPoints.add(mountPoint);
    }

    /**
     * Find the first mount point with exactly the given name.
     */
    public Optional<MountPoint> findMountPoint(String name) {
        return mountPoints.stream()
                .filter(mp -> mp.getName().equals(name))
                .findFirst();
    }

    /**
     * Deep copy; the result shares no mutable state with this storage.
     */
    public Storage copy() {
        Storage copy = new Storage();
        mountPoints.forEach(mp -> copy.addMountPoint(mp.copy()));
        return copy;
    }
}
