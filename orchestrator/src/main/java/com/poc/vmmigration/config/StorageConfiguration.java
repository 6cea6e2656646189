package com.poc.vmmigration.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.vmmigration.model.Migration;
import com.poc.vmmigration.model.Workload;
import com.poc.vmmigration.store.FileObjectStore;
import com.poc.vmmigration.store.InMemoryObjectStore;
import com.poc.vmmigration.store.MigrationRepository;
import com.poc.vmmigration.store.ObjectStore;
import com.poc.vmmigration.store.WorkloadRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Configuration for object storage beans.
 */
@Configuration
@Slf4j
public class StorageConfiguration {

    static final String WORKLOAD_TYPE = "workload";
    static final String MIGRATION_TYPE = "migration";
    
    @Bean
    public WorkloadRepository workloadRepository(ObjectMapper objectMapper, MigrationProperties properties) {
        return new WorkloadRepository(createStore(objectMapper, properties, Workload.class, WORKLOAD_TYPE));
    }

    @Bean
    public MigrationRepository migrationRepository(ObjectMapper objectMapper, MigrationProperties properties) {
        return new MigrationRepository(createStore(objectMapper, properties, Migration.class, MIGRATION_TYPE));
    }

    private <T> ObjectStore<T> createStore(
            ObjectMapper objectMapper, MigrationProperties properties, Class<T> type, String typeName) {
        MigrationProperties.StorageConfig storage = properties.getStorage();
        if (storage.getType() == MigrationProperties.StorageType.MEMORY) {
            log.info("Using in-memory store for {} objects", typeName);
            return new InMemoryObjectStore<>(objectMapper, type, typeName);
        }
        return new FileObjectStore<>(Path.of(storage.getDir()), objectMapper, type, typeName);
    }
}
