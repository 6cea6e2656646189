package com.poc.vmmigration.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Status view of a migration.
 */
@Data
@AllArgsConstructor
public class MigrationStatus {

    private String migrationId;

    private MigrationState state;

    /**
     * True once the migration reached SUCCESS or ERROR.
     */
    private boolean finished;

    public static MigrationStatus of(Migration migration) {
        return new MigrationStatus(migration.getId(), migration.getState(), migration.isFinished());
    }
}
