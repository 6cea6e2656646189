package com.poc.vmmigration.orchestration;

import com.poc.vmmigration.model.Migration;
import com.poc.vmmigration.model.MigrationState;

/**
 * Callback invoked after every state transition of a running migration.
 * Called on the thread executing the run, after the new state is visible.
 */
@FunctionalInterface
public interface MigrationStateListener {

    MigrationStateListener NO_OP = (migration, state) -> { };

    void onStateChange(Migration migration, MigrationState state);
}
