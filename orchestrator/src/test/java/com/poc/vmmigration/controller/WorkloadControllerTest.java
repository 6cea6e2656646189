package com.poc.vmmigration.controller;

import com.poc.vmmigration.TestFixtures;
import com.poc.vmmigration.config.JacksonConfiguration;
import com.poc.vmmigration.exception.DuplicateKeyException;
import com.poc.vmmigration.exception.InvalidStateException;
import com.poc.vmmigration.exception.NotFoundException;
import com.poc.vmmigration.exception.StorageException;
import com.poc.vmmigration.model.WorkloadRequest;
import com.poc.vmmigration.model.WorkloadUpdateRequest;
import com.poc.vmmigration.service.WorkloadService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WorkloadController.class)
@Import(JacksonConfiguration.class)
class WorkloadControllerTest {

    private static final String WORKLOAD_JSON = "{"
            + "\"ip\":\"192.168.1.10\","
            + "\"credentials\":{\"username\":\"admin\",\"password\":\"secret\",\"domain\":\"corp.local\"},"
            + "\"storage\":{\"mount_points\":["
            + "{\"mount_point_name\":\"C:\\\\\",\"total_size\":1000},"
            + "{\"mount_point_name\":\"D:\\\\\",\"total_size\":2000}]}}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WorkloadService workloadService;

    @Test
    void createReturns201WithWorkload() throws Exception {
        when(workloadService.createWorkload(any(WorkloadRequest.class)))
                .thenReturn(TestFixtures.sourceWorkload("192.168.1.10"));

        mockMvc.perform(post("/workloads").contentType(MediaType.APPLICATION_JSON).content(WORKLOAD_JSON))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ip").value("192.168.1.10"))
                .andExpect(jsonPath("$.storage.mount_points[0].mount_point_name").value("C:\\"))
                .andExpect(jsonPath("$.storage.mount_points[1].total_size").value(2000));
    }

    @Test
    void duplicateIpReturns409() throws Exception {
        when(workloadService.createWorkload(any(WorkloadRequest.class)))
                .thenThrow(new DuplicateKeyException("Workload with IP 192.168.1.10 already exists"));

        mockMvc.perform(post("/workloads").contentType(MediaType.APPLICATION_JSON).content(WORKLOAD_JSON))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Workload with IP 192.168.1.10 already exists"));
    }

    @Test
    void invalidCredentialsReturn400WithoutCallingService() throws Exception {
        String body = "{\"ip\":\"192.168.1.10\","
                + "\"credentials\":{\"username\":\"\",\"password\":\"secret\",\"domain\":\"corp\"}}";

        mockMvc.perform(post("/workloads").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Username and password cannot be null or empty"));

        verifyNoInteractions(workloadService);
    }

    @Test
    void missingIpReturns400() throws Exception {
        String body = "{\"credentials\":{\"username\":\"admin\",\"password\":\"secret\",\"domain\":\"corp\"}}";

        mockMvc.perform(post("/workloads").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.ip").value("Workload IP is required"));
    }

    @Test
    void unknownWorkloadReturns404() throws Exception {
        when(workloadService.getWorkload("10.9.9.9")).thenThrow(new NotFoundException("Workload 10.9.9.9 not found"));

        mockMvc.perform(get("/workloads/10.9.9.9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listReturnsAllWorkloads() throws Exception {
        when(workloadService.listWorkloads()).thenReturn(List.of(
                TestFixtures.sourceWorkload("192.168.1.10"), TestFixtures.sourceWorkload("192.168.1.11")));

        mockMvc.perform(get("/workloads"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].ip").value("192.168.1.11"));
    }

    @Test
    void ipChangeOnUpdateReturns400() throws Exception {
        when(workloadService.updateWorkload(eq("192.168.1.10"), any(WorkloadUpdateRequest.class)))
                .thenThrow(new InvalidStateException("IP address cannot be changed once set (current: 192.168.1.10)"));

        mockMvc.perform(put("/workloads/192.168.1.10")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ip\":\"192.168.1.99\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid State"));
    }

    @Test
    void deleteReturns204() throws Exception {
        mockMvc.perform(delete("/workloads/192.168.1.10"))
                .andExpect(status().isNoContent());

        verify(workloadService).deleteWorkload("192.168.1.10");
    }

    @Test
    void unexpectedFailureReturns500WithoutDetails() throws Exception {
        doThrow(new StorageException("Failed to list workload objects in /var/lib/secret",
                new IOException("disk full")))
                .when(workloadService).listWorkloads();

        mockMvc.perform(get("/workloads"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("An unexpected error occurred. Please check logs for details."));
    }
}
