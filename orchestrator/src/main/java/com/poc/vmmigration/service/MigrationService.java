package com.poc.vmmigration.service;

import com.poc.vmmigration.config.AsyncConfiguration;
import com.poc.vmmigration.config.MigrationProperties;
import com.poc.vmmigration.exception.InvalidArgumentException;
import com.poc.vmmigration.exception.InvalidStateException;
import com.poc.vmmigration.exception.MigrationException;
import com.poc.vmmigration.model.Migration;
import com.poc.vmmigration.model.MigrationRequest;
import com.poc.vmmigration.model.MigrationState;
import com.poc.vmmigration.model.MigrationStatus;
import com.poc.vmmigration.model.MigrationUpdateRequest;
import com.poc.vmmigration.model.StartMigrationRequest;
import com.poc.vmmigration.model.Workload;
import com.poc.vmmigration.orchestration.MigrationStateListener;
import com.poc.vmmigration.orchestration.MountPointTransfer;
import com.poc.vmmigration.store.MigrationRepository;
import com.poc.vmmigration.store.WorkloadRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Service for managing migrations and running them.
 * <p>
 * Each request reads its own copy of a migration from the store, so the
 * service tracks active runs by ID: a migration can only be started once at
 * a time, and it cannot be modified or deleted while it runs. Every state
 * transition of a run is written through to the store; a run whose terminal
 * state could not be stored stays registered until a later call stores it.
 */
@Service
@Slf4j
public class MigrationService {

    private static final long MILLIS_PER_MINUTE = 60_000L;

    private final MigrationRepository migrationRepository;
    private final WorkloadRepository workloadRepository;
    private final MountPointTransfer mountPointTransfer;
    private final MigrationProperties properties;
    private final TaskExecutor taskExecutor;

    private final ConcurrentMap<String, Migration> activeRuns = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();

    public MigrationService(
            MigrationRepository migrationRepository,
            WorkloadRepository workloadRepository,
            MountPointTransfer mountPointTransfer,
            MigrationProperties properties,
            @Qualifier(AsyncConfiguration.MIGRATION_EXECUTOR) TaskExecutor taskExecutor) {
        this.migrationRepository = migrationRepository;
        this.workloadRepository = workloadRepository;
        this.mountPointTransfer = mountPointTransfer;
        this.properties = properties;
        this.taskExecutor = taskExecutor;
    }

    public Migration createMigration(MigrationRequest request) {
        Workload source = request.getSource() != null
                ? request.getSource()
                : workloadRepository.read(request.getSourceIp());

        Migration migration = new Migration(
                request.getSelectedMountPoints(), source, request.getMigrationTarget());
        migrationRepository.create(migration);

        log.info("[Migration-{}] Created: {} -> {}", migration.getId(), source.getIp(),
                migration.getMigrationTarget().getCloudType().getValue());
        return migration;
    }

    /**
     * Current view of a migration; a running one is served from memory.
     */
    public Migration getMigration(String id) {
        Migration active = activeRuns.get(id);
        return active != null ? active : migrationRepository.read(id);
    }

    public List<Migration> listMigrations() {
        return migrationRepository.listAll().stream()
                .map(stored -> activeRuns.getOrDefault(stored.getId(), stored))
                .collect(Collectors.toList());
    }

    public Migration updateMigration(String id, MigrationUpdateRequest request) {
        synchronized (lifecycleLock) {
            requireNotActive(id, "modify");
            Migration migration = migrationRepository.read(id);
            migration.updateSelectedMountPoints(request.getSelectedMountPoints());
            migrationRepository.update(migration);
            log.info("[Migration-{}] Selected mount points updated", id);
            return migration;
        }
    }

    public void deleteMigration(String id) {
        synchronized (lifecycleLock) {
            requireNotActive(id, "delete");
            migrationRepository.delete(id);
            log.info("[Migration-{}] Deleted", id);
        }
    }

    public MigrationStatus getStatus(String id) {
        return MigrationStatus.of(getMigration(id));
    }

    /**
     * Run a migration to completion.
     *
     * @return the migration in its terminal state
     * @throws InvalidStateException if the migration is running or finished
     * @throws com.poc.vmmigration.exception.MigrationExecutionException if the copy phase fails
     */
    public Migration startMigration(String id, StartMigrationRequest request) {
        Duration delay = resolveDelay(request);
        Migration migration = claim(id);
        PersistingListener listener = new PersistingListener();
        try {
            migration.run(delay, mountPointTransfer, listener);
        } finally {
            release(migration, listener);
        }
        return migration;
    }

    /**
     * Mark a migration RUNNING on the calling thread and hand the rest of the
     * run to the worker pool. The outcome is observed through
     * {@link #getStatus(String)}.
     *
     * @throws MigrationException if the worker pool cannot accept the run; the migration stays NOT_STARTED
     */
    public Migration startMigrationAsync(String id, StartMigrationRequest request) {
        Duration delay = resolveDelay(request);
        Migration migration = claim(id);
        PersistingListener listener = new PersistingListener();

        CompletableFuture<Boolean> begun = new CompletableFuture<>();
        try {
            taskExecutor.execute(() -> {
                if (begun.join()) {
                    completeInBackground(migration, delay, listener);
                }
            });
        } catch (TaskRejectedException e) {
            activeRuns.remove(id, migration);
            throw new MigrationException("Migration worker pool is saturated, cannot start " + id, e);
        }

        try {
            migration.begin(listener);
        } catch (RuntimeException e) {
            begun.complete(false);
            release(migration, listener);
            throw e;
        }
        begun.complete(true);
        return migration;
    }

    private void completeInBackground(Migration migration, Duration delay, PersistingListener listener) {
        try {
            migration.complete(delay, mountPointTransfer, listener);
        } catch (RuntimeException e) {
            log.error("[Migration-{}] Asynchronous run failed: {}", migration.getId(), e.getMessage());
        } finally {
            release(migration, listener);
        }
    }

    private Migration claim(String id) {
        synchronized (lifecycleLock) {
            requireNotActive(id, "start");
            Migration migration = migrationRepository.read(id);
            if (migration.getState() == MigrationState.RUNNING) {
                throw new InvalidStateException("Migration is already running: " + id);
            }
            if (migration.isFinished()) {
                throw new InvalidStateException(
                        "Migration " + id + " already finished with state " + migration.getState().getValue());
            }
            activeRuns.put(id, migration);
            return migration;
        }
    }

    /**
     * Drop a finished run from the registry once its terminal state is stored.
     * Otherwise it stays registered and the next lifecycle call writes it.
     */
    private void release(Migration migration, PersistingListener listener) {
        if (listener.terminalPersisted) {
            activeRuns.remove(migration.getId(), migration);
        } else {
            log.error("[Migration-{}] Terminal state {} not stored, keeping it in memory",
                    migration.getId(), migration.getState().getValue());
        }
    }

    private void requireNotActive(String id, String action) {
        Migration active = activeRuns.get(id);
        if (active == null) {
            return;
        }
        if (!active.isFinished()) {
            throw new InvalidStateException("Cannot " + action + " migration " + id + " while it is running");
        }
        migrationRepository.update(active);
        activeRuns.remove(id, active);
        log.info("[Migration-{}] Pending terminal state stored: {}", id, active.getState().getValue());
    }

    /**
     * Writes every transition through to the store.
     */
    private final class PersistingListener implements MigrationStateListener {

        private volatile boolean terminalPersisted;

        @Override
        public void onStateChange(Migration migration, MigrationState state) {
            migrationRepository.update(migration);
            log.debug("[Migration-{}] State persisted: {}", migration.getId(), state.getValue());
            if (state.isTerminal()) {
                terminalPersisted = true;
            }
        }
    }

    private Duration resolveDelay(StartMigrationRequest request) {
        double minutes = request != null && request.getDelayMinutes() != null
                ? request.getDelayMinutes()
                : properties.getRun().getDefaultDelayMinutes();
        if (Double.isNaN(minutes) || Double.isInfinite(minutes) || minutes < 0) {
            throw new InvalidArgumentException("Delay must be a non-negative number of minutes: " + minutes);
        }
        return Duration.ofMillis(Math.round(minutes * MILLIS_PER_MINUTE));
    }
}
