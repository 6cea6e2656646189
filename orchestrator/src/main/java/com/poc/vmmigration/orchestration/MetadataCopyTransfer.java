package com.poc.vmmigration.orchestration;

import com.poc.vmmigration.model.MountPoint;
import com.poc.vmmigration.model.Storage;
import com.poc.vmmigration.model.Workload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Placeholder transfer: duplicates mount point metadata, moves no data.
 * Selected names missing from the source are skipped.
 */
@Component
@Slf4j
public class MetadataCopyTransfer implements MountPointTransfer {

    @Override
    public Storage transfer(Workload source, List<MountPoint> selectedMountPoints) {
        Storage targetStorage = new Storage();
        for (MountPoint selected : selectedMountPoints) {
            Optional<MountPoint> sourceMountPoint = source.getStorage().findMountPoint(selected.getName());
            if (sourceMountPoint.isPresent()) {
                targetStorage.addMountPoint(sourceMountPoint.get().copy());
            } else {
                log.warn("Selected mount point '{}' not found on source {}, skipping",
                        selected.getName(), source.getIp());
            }
        }
        return targetStorage;
    }
}
