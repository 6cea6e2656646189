package com.poc.vmmigration.store;

import com.poc.vmmigration.model.Migration;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Migrations keyed by ID.
 */
@RequiredArgsConstructor
public class MigrationRepository {

    private final ObjectStore<Migration> store;

    public Migration create(Migration migration) {
        return store.create(migration.getId(), migration);
    }

    public Migration read(String id) {
        return store.read(id);
    }

    public Migration update(Migration migration) {
        return store.update(migration.getId(), migration);
    }

    public void delete(String id) {
        store.delete(id);
    }

    public List<Migration> listAll() {
        return store.listAll();
    }
}
