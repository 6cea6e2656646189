package com.poc.vmmigration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the VM Migration Orchestrator.
 */
@SpringBootApplication
public class VmMigrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(VmMigrationApplication.class, args);
    }
}
