package com.poc.vmmigration.service;

import com.poc.vmmigration.model.Workload;
import com.poc.vmmigration.model.WorkloadRequest;
import com.poc.vmmigration.model.WorkloadUpdateRequest;
import com.poc.vmmigration.store.WorkloadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service for managing source workloads.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkloadService {

    private final WorkloadRepository workloadRepository;

    public Workload createWorkload(WorkloadRequest request) {
        Workload workload = workloadRepository.create(request.toWorkload());
        log.info("Workload registered: {} ({} mount point(s))",
                workload.getIp(), workload.getStorage().getMountPoints().size());
        return workload;
    }

    public Workload getWorkload(String ip) {
        return workloadRepository.read(ip);
    }

    public List<Workload> listWorkloads() {
        return workloadRepository.listAll();
    }

    /**
     * Replace credentials and/or storage. The IP cannot change.
     */
    public Workload updateWorkload(String ip, WorkloadUpdateRequest request) {
        Workload workload = workloadRepository.read(ip);

        if (request.getIp() != null && !request.getIp().equals(ip)) {
            workload.setIp(request.getIp());
        }
        if (request.getCredentials() != null) {
            workload.setCredentials(request.getCredentials());
        }
        if (request.getStorage() != null) {
            workload.setStorage(request.getStorage());
        }

        Workload updated = workloadRepository.update(workload);
        log.info("Workload updated: {}", ip);
        return updated;
    }

    public void deleteWorkload(String ip) {
        workloadRepository.delete(ip);
        log.info("Workload deleted: {}", ip);
    }
}
