package com.poc.vmmigration.store;

import com.poc.vmmigration.exception.DuplicateKeyException;
import com.poc.vmmigration.model.Workload;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Workloads keyed by IP.
 */
@RequiredArgsConstructor
public class WorkloadRepository {

    private final ObjectStore<Workload> store;

    /**
     * Store a new workload.
     *
     * @throws DuplicateKeyException if a workload with the same IP exists
     */
    public synchronized Workload create(Workload workload) {
        boolean duplicate = store.listAll().stream()
                .anyMatch(existing -> existing.getIp().equals(workload.getIp()));
        if (duplicate) {
            throw new DuplicateKeyException("Workload with IP " + workload.getIp() + " already exists");
        }
        return store.create(workload.getIp(), workload);
    }

    public Workload read(String ip) {
        return store.read(ip);
    }

    public synchronized Workload update(Workload workload) {
        return store.update(workload.getIp(), workload);
    }

    public synchronized void delete(String ip) {
        store.delete(ip);
    }

    public List<Workload> listAll() {
        return store.listAll();
    }
}
