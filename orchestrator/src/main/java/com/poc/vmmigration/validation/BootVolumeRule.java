package com.poc.vmmigration.validation;

import com.poc.vmmigration.exception.InvalidArgumentException;
import com.poc.vmmigration.model.MountPoint;
import com.poc.vmmigration.model.Storage;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * The system drive must be part of any migration whose source has one.
 */
public final class BootVolumeRule {

    private static final Set<String> BOOT_VOLUME_NAMES = Set.of("c:\\", "c:/", "c:");

    static final String MISSING_BOOT_VOLUME = "C:\\ drive must be selected for migration if it exists in source";

    private BootVolumeRule() {
        // Utility class - prevent instantiation
    }

    /**
     * Checks whether a mount point name denotes the boot volume, ignoring case.
     */
    public static boolean isBootVolume(String mountPointName) {
        return mountPointName != null
                && BOOT_VOLUME_NAMES.contains(mountPointName.toLowerCase(Locale.ROOT));
    }

    public static boolean containsBootVolume(Collection<MountPoint> mountPoints) {
        return mountPoints.stream().anyMatch(mp -> isBootVolume(mp.getName()));
    }

    /**
     * Throws if the source storage has a boot volume and the selection does not.
     */
    public static void validate(Storage sourceStorage, Collection<MountPoint> selectedMountPoints) {
        if (containsBootVolume(sourceStorage.getMountPoints())
                && !containsBootVolume(selectedMountPoints)) {
            throw new InvalidArgumentException(MISSING_BOOT_VOLUME);
        }
    }
}
