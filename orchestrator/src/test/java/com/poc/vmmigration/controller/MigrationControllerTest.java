package com.poc.vmmigration.controller;

import com.poc.vmmigration.TestFixtures;
import com.poc.vmmigration.config.JacksonConfiguration;
import com.poc.vmmigration.exception.InvalidArgumentException;
import com.poc.vmmigration.exception.InvalidStateException;
import com.poc.vmmigration.exception.NotFoundException;
import com.poc.vmmigration.model.Migration;
import com.poc.vmmigration.model.MigrationRequest;
import com.poc.vmmigration.model.MigrationState;
import com.poc.vmmigration.model.MigrationStatus;
import com.poc.vmmigration.model.StartMigrationRequest;
import com.poc.vmmigration.service.MigrationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;

import static com.poc.vmmigration.TestFixtures.C_DRIVE;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MigrationController.class)
@Import(JacksonConfiguration.class)
class MigrationControllerTest {

    private static final String CREDENTIALS = "{\"username\":\"admin\",\"password\":\"secret\",\"domain\":\"corp\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MigrationService migrationService;

    private static Migration migration() {
        return new Migration(List.of(C_DRIVE), TestFixtures.sourceWorkload("192.168.1.10"), TestFixtures.awsTarget());
    }

    private static String migrationJson(String cloudType) {
        return "{\"selected_mount_points\":[{\"mount_point_name\":\"C:\\\\\",\"total_size\":1000}],"
                + "\"source_ip\":\"192.168.1.10\","
                + "\"migration_target\":{\"cloud_type\":\"" + cloudType + "\","
                + "\"cloud_credentials\":" + CREDENTIALS + ","
                + "\"target_vm\":{\"ip\":\"10.0.1.100\",\"credentials\":" + CREDENTIALS + "}}}";
    }

    @Test
    void createReturns201() throws Exception {
        Migration migration = migration();
        when(migrationService.createMigration(any(MigrationRequest.class))).thenReturn(migration);

        mockMvc.perform(post("/migrations").contentType(MediaType.APPLICATION_JSON).content(migrationJson("AWS")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(migration.getId()))
                .andExpect(jsonPath("$.migration_state").value("not_started"))
                .andExpect(jsonPath("$.migration_target.cloud_type").value("aws"));
    }

    @Test
    void unknownCloudTypeReturns400() throws Exception {
        mockMvc.perform(post("/migrations").contentType(MediaType.APPLICATION_JSON).content(migrationJson("gcp")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("Invalid cloud type")));

        verifyNoInteractions(migrationService);
    }

    @Test
    void missingSourceReturns400() throws Exception {
        String body = migrationJson("aws").replace("\"source_ip\":\"192.168.1.10\",", "");

        mockMvc.perform(post("/migrations").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));
    }

    @Test
    void bootVolumeViolationReturns400() throws Exception {
        when(migrationService.createMigration(any(MigrationRequest.class)))
                .thenThrow(new InvalidArgumentException("C:\\ drive must be selected for migration if it exists in source"));

        mockMvc.perform(post("/migrations").contentType(MediaType.APPLICATION_JSON).content(migrationJson("aws")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("C:\\ drive must be selected for migration if it exists in source"));
    }

    @Test
    void startWithoutBodyRunsSynchronously() throws Exception {
        Migration migration = migration();
        migration.run(Duration.ZERO);
        when(migrationService.startMigration(eq(migration.getId()), isNull())).thenReturn(migration);

        mockMvc.perform(post("/migrations/{id}/start", migration.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.migration_state").value("success"))
                .andExpect(jsonPath("$.migration_target.target_vm.storage.mount_points[0].mount_point_name")
                        .value("C:\\"));
    }

    @Test
    void asyncStartReturns202() throws Exception {
        Migration migration = migration();
        when(migrationService.startMigrationAsync(eq(migration.getId()), any(StartMigrationRequest.class)))
                .thenReturn(migration);

        mockMvc.perform(post("/migrations/{id}/start", migration.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"delay_minutes\":0.5,\"async\":true}"))
                .andExpect(status().isAccepted());
    }

    @Test
    void negativeDelayReturns400() throws Exception {
        mockMvc.perform(post("/migrations/{id}/start", "123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"delay_minutes\":-1}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(migrationService);
    }

    @Test
    void startOfRunningMigrationReturns400() throws Exception {
        when(migrationService.startMigration(eq("123"), any()))
                .thenThrow(new InvalidStateException("Migration is already running: 123"));

        mockMvc.perform(post("/migrations/{id}/start", "123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"delay_minutes\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Migration is already running: 123"));
    }

    @Test
    void statusReportsStateAndFinishedFlag() throws Exception {
        when(migrationService.getStatus("123"))
                .thenReturn(new MigrationStatus("123", MigrationState.RUNNING, false));

        mockMvc.perform(get("/migrations/{id}/status", "123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.migration_id").value("123"))
                .andExpect(jsonPath("$.state").value("running"))
                .andExpect(jsonPath("$.finished").value(false));
    }

    @Test
    void unknownMigrationReturns404() throws Exception {
        when(migrationService.getMigration("999")).thenThrow(new NotFoundException("Migration 999 not found"));

        mockMvc.perform(get("/migrations/{id}", "999"))
                .andExpect(status().isNotFound());
    }
}
