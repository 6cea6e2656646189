package com.poc.vmmigration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.poc.vmmigration.exception.InvalidArgumentException;
import com.poc.vmmigration.exception.InvalidStateException;
import com.poc.vmmigration.exception.MigrationExecutionException;
import com.poc.vmmigration.orchestration.MetadataCopyTransfer;
import com.poc.vmmigration.orchestration.MigrationStateListener;
import com.poc.vmmigration.orchestration.MountPointTransfer;
import com.poc.vmmigration.util.MigrationIdGenerator;
import com.poc.vmmigration.validation.BootVolumeRule;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A migration job: copies a selection of a source workload's mount points
 * to a cloud target.
 * <p>
 * The source is a deep copy taken at construction, so later edits to the
 * persisted workload do not affect the job. State only moves forward:
 * NOT_STARTED, then RUNNING, then SUCCESS or ERROR.
 */
@Slf4j
public class Migration {

    private final String id;
    private final Workload source;
    private final MigrationTarget migrationTarget;
    private final LocalDateTime createdAt;
    private final AtomicReference<MigrationState> state;

    private volatile List<MountPoint> selectedMountPoints;

    /**
     * Create a new migration in state NOT_STARTED.
     *
     * @throws InvalidArgumentException if a field is missing or the source's
     *         boot volume is not selected
     */
    public Migration(List<MountPoint> selectedMountPoints, Workload source, MigrationTarget migrationTarget) {
        this(MigrationIdGenerator.nextId(), selectedMountPoints, requireSource(source).copy(), migrationTarget,
                MigrationState.NOT_STARTED, LocalDateTime.now());
        BootVolumeRule.validate(this.source.getStorage(), this.selectedMountPoints);
    }

    private Migration(String id, List<MountPoint> selectedMountPoints, Workload source,
                      MigrationTarget migrationTarget, MigrationState state, LocalDateTime createdAt) {
        if (StringUtils.isEmpty(id)) {
            throw new InvalidArgumentException("Migration id cannot be null or empty");
        }
        if (migrationTarget == null) {
            throw new InvalidArgumentException("Migration target is required");
        }
        this.id = id;
        this.selectedMountPoints = copySelection(selectedMountPoints);
        this.source = requireSource(source);
        this.migrationTarget = migrationTarget;
        this.state = new AtomicReference<>(state == null ? MigrationState.NOT_STARTED : state);
        this.createdAt = createdAt == null ? LocalDateTime.now() : createdAt;
    }

    /**
     * Rebuild a stored migration with its original id, state and creation time.
     */
    @JsonCreator
    public static Migration restore(
            @JsonProperty("id") String id,
            @JsonProperty("selected_mount_points") List<MountPoint> selectedMountPoints,
            @JsonProperty("source") Workload source,
            @JsonProperty("migration_target") MigrationTarget migrationTarget,
            @JsonProperty("migration_state") MigrationState state,
            @JsonProperty("created_at") LocalDateTime createdAt) {
        return new Migration(id, selectedMountPoints, source, migrationTarget, state, createdAt);
    }

    private static Workload requireSource(Workload source) {
        if (source == null) {
            throw new InvalidArgumentException("Source workload is required");
        }
        return source;
    }

    private static List<MountPoint> copySelection(List<MountPoint> mountPoints) {
        if (mountPoints == null || mountPoints.stream().anyMatch(Objects::isNull)) {
            throw new InvalidArgumentException("Selected mount points are required and cannot contain null");
        }
        return List.copyOf(mountPoints);
    }

    public String getId() {
        return id;
    }

    @JsonProperty("selected_mount_points")
    public List<MountPoint> getSelectedMountPoints() {
        return selectedMountPoints;
    }

    public Workload getSource() {
        return source;
    }

    @JsonProperty("migration_target")
    public MigrationTarget getMigrationTarget() {
        return migrationTarget;
    }

    @JsonProperty("migration_state")
    public MigrationState getState() {
        return state.get();
    }

    @JsonProperty("created_at")
    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    @JsonIgnore
    public boolean isFinished() {
        return getState().isTerminal();
    }

    /**
     * Replace the selected mount points.
     *
     * @throws InvalidStateException if the migration is running or completed
     * @throws InvalidArgumentException if the new selection drops the boot volume
     */
    public synchronized void updateSelectedMountPoints(List<MountPoint> mountPoints) {
        MigrationState current = getState();
        if (current == MigrationState.RUNNING || current == MigrationState.SUCCESS) {
            throw new InvalidStateException(
                    "Cannot modify running or completed migration " + id + " (state: " + current.getValue() + ")");
        }
        List<MountPoint> selection = copySelection(mountPoints);
        BootVolumeRule.validate(source.getStorage(), selection);
        this.selectedMountPoints = selection;
    }

    /**
     * Run the migration with the metadata-only transfer.
     *
     * @see #run(Duration, MountPointTransfer, MigrationStateListener)
     */
    public void run(Duration delay) {
        run(delay, new MetadataCopyTransfer(), MigrationStateListener.NO_OP);
    }

    /**
     * Run the migration and block until it reaches a terminal state.
     * <p>
     * The state is RUNNING before the delay starts and stays RUNNING for the
     * whole delay. The transfer result replaces the target VM's storage.
     *
     * @param delay simulated transfer time, not negative
     * @param transfer copy phase
     * @param listener notified after each transition
     * @throws InvalidStateException if the migration is running or already finished
     * @throws MigrationExecutionException if the copy phase fails; the state is then ERROR
     */
    public void run(Duration delay, MountPointTransfer transfer, MigrationStateListener listener) {
        requireDelay(delay);
        begin(listener);
        complete(delay, transfer, listener);
    }

    /**
     * Move from NOT_STARTED to RUNNING and notify the listener.
     * {@link #complete} carries the run on, possibly on another thread.
     *
     * @throws InvalidStateException if the migration is running or already finished
     * @throws MigrationExecutionException if the listener fails; the state is then ERROR
     */
    public void begin(MigrationStateListener listener) {
        claimRun();
        log.info("[Migration-{}] Started, {} mount point(s) selected", id, selectedMountPoints.size());
        try {
            listener.onStateChange(this, MigrationState.RUNNING);
        } catch (RuntimeException e) {
            throw fail(listener, new MigrationExecutionException(
                    "Migration " + id + " failed: " + e.getMessage(), e));
        }
    }

    /**
     * Wait out the delay, copy the selected mount points and finish the run.
     *
     * @throws InvalidStateException if the migration is not RUNNING
     * @throws MigrationExecutionException if the copy phase fails; the state is then ERROR
     */
    public void complete(Duration delay, MountPointTransfer transfer, MigrationStateListener listener) {
        requireDelay(delay);
        if (getState() != MigrationState.RUNNING) {
            throw new InvalidStateException(
                    "Migration " + id + " is not running (state: " + getState().getValue() + ")");
        }
        log.debug("[Migration-{}] Waiting {} ms before transfer", id, delay.toMillis());

        try {
            Thread.sleep(delay.toMillis());
            Storage targetStorage = transfer.transfer(source, selectedMountPoints);
            migrationTarget.getTargetVm().setStorage(targetStorage);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw fail(listener, new MigrationExecutionException("Migration " + id + " was interrupted", e));
        } catch (RuntimeException e) {
            throw fail(listener, new MigrationExecutionException(
                    "Migration " + id + " failed: " + e.getMessage(), e));
        }

        state.set(MigrationState.SUCCESS);
        log.info("[Migration-{}] Completed, {} mount point(s) copied to {}",
                id, migrationTarget.getTargetVm().getStorage().getMountPoints().size(),
                migrationTarget.getCloudType().getValue());
        listener.onStateChange(this, MigrationState.SUCCESS);
    }

    private static void requireDelay(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new InvalidArgumentException("Delay must be a non-negative duration");
        }
    }

    private synchronized void claimRun() {
        if (!state.compareAndSet(MigrationState.NOT_STARTED, MigrationState.RUNNING)) {
            MigrationState current = getState();
            if (current == MigrationState.RUNNING) {
                throw new InvalidStateException("Migration is already running: " + id);
            }
            throw new InvalidStateException(
                    "Migration " + id + " already finished with state " + current.getValue());
        }
    }

    private MigrationExecutionException fail(MigrationStateListener listener, MigrationExecutionException failure) {
        state.set(MigrationState.ERROR);
        log.error("[Migration-{}] Failed: {}", id, failure.getMessage());
        try {
            listener.onStateChange(this, MigrationState.ERROR);
        } catch (RuntimeException listenerFailure) {
            failure.addSuppressed(listenerFailure);
        }
        return failure;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Migration)) {
            return false;
        }
        Migration other = (Migration) o;
        return id.equals(other.id)
                && selectedMountPoints.equals(other.selectedMountPoints)
                && source.equals(other.source)
                && migrationTarget.equals(other.migrationTarget)
                && getState() == other.getState()
                && createdAt.equals(other.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, selectedMountPoints, source, migrationTarget, getState(), createdAt);
    }

    @Override
    public String toString() {
        return "Migration(id=" + id + ", state=" + getState() + ", source=" + source.getIp()
                + ", cloudType=" + migrationTarget.getCloudType() + ", selectedMountPoints=" + selectedMountPoints + ")";
    }
}
