package com.poc.vmmigration.orchestration;

import com.poc.vmmigration.model.MountPoint;
import com.poc.vmmigration.model.Storage;
import com.poc.vmmigration.model.Workload;

import java.util.List;

/**
 * Copy phase of a migration run: builds the target VM's storage from the
 * selected source mount points.
 */
@FunctionalInterface
public interface MountPointTransfer {

    /**
     * Build a fresh storage for the target.
     *
     * @param source the migration's embedded source workload
     * @param selectedMountPoints the mount points chosen for migration, in order
     * @return storage that replaces the target VM's storage
     */
    Storage transfer(Workload source, List<MountPoint> selectedMountPoints);
}
