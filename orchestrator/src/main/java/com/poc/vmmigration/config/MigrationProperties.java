package com.poc.vmmigration.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for migration operations.
 */
@Configuration
@ConfigurationProperties(prefix = "migration")
@Data
public class MigrationProperties {
    
    /**
     * Object storage configuration.
     */
    private StorageConfig storage = new StorageConfig();
    
    /**
     * Migration run configuration.
     */
    private RunConfig run = new RunConfig();
    
    /**
     * Worker pool for asynchronous runs.
     */
    private ExecutorConfig executor = new ExecutorConfig();
    
    public enum StorageType {
        FILE,
        MEMORY
    }
    
    @Data
    public static class StorageConfig {
        /**
         * Backing store for workloads and migrations.
         */
        private StorageType type = StorageType.FILE;
        
        /**
         * Directory holding one JSON file per object (file storage only).
         */
        private String dir = "migration_data";
    }
    
    @Data
    public static class RunConfig {
        /**
         * Simulated transfer time used when a start request gives none (minutes).
         */
        private double defaultDelayMinutes = 0.1;
    }
    
    @Data
    public static class ExecutorConfig {
        private int corePoolSize = 2;
        
        private int maxPoolSize = 4;
        
        /**
         * Runs waiting for a free worker before new starts are rejected.
         */
        private int queueCapacity = 50;
    }
}
