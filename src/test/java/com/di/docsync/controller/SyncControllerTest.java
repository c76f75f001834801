package com.di.docsync.controller;

import com.di.docsync.exception.GlobalExceptionHandler;
import com.di.docsync.exception.SourceConnectionException;
import com.di.docsync.exception.UnknownJobException;
import com.di.docsync.sync.JobStatus;
import com.di.docsync.sync.SyncMode;
import com.di.docsync.sync.SyncOrchestrator;
import com.di.docsync.sync.SyncRequest;
import com.di.docsync.sync.SyncResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("SyncController Tests")
class SyncControllerTest {

    private SyncOrchestrator orchestrator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(SyncOrchestrator.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new SyncController(orchestrator))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static SyncResult pending(String jobId, SyncMode mode) {
        return new SyncResult(jobId, mode, JobStatus.PENDING, false, Instant.parse("2024-06-01T12:00:00Z"), null,
                List.of(), 0, 0, 0, 0, List.of(), List.of(), null);
    }

    // ============================================================================
    // Runs
    // ============================================================================

    @Test
    @DisplayName("Should accept a full sync with its options")
    void testFull_Accepted() throws Exception {
        when(orchestrator.submit(eq(SyncMode.FULL), any())).thenReturn(pending("job-1", SyncMode.FULL));

        mockMvc.perform(post("/api/sync/full")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"include\":[\"photos\"],\"dryRun\":true}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job-1"))
                .andExpect(jsonPath("$.status").value("PENDING"));

        ArgumentCaptor<SyncRequest> request = ArgumentCaptor.forClass(SyncRequest.class);
        verify(orchestrator).submit(eq(SyncMode.FULL), request.capture());
        assertEquals(List.of("photos"), request.getValue().getInclude());
        assertTrue(request.getValue().isDryRun());
        assertTrue(request.getValue().isDownloadFiles());
    }

    @Test
    @DisplayName("Should accept an incremental sync without a body")
    void testIncremental_NoBody() throws Exception {
        when(orchestrator.submit(eq(SyncMode.INCREMENTAL), isNull())).thenReturn(pending("job-2", SyncMode.INCREMENTAL));

        mockMvc.perform(post("/api/sync/incremental"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.mode").value("INCREMENTAL"));
    }

    @Test
    @DisplayName("Should answer 400 when a job is already running")
    void testFull_AlreadyRunning() throws Exception {
        when(orchestrator.submit(eq(SyncMode.FULL), any())).thenThrow(new IllegalStateException("A sync job is already running: job-1"));

        mockMvc.perform(post("/api/sync/full"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("A sync job is already running: job-1"));
    }

    @Test
    @DisplayName("Should reject an invalid table name before syncing")
    void testSyncTable_InvalidName() throws Exception {
        mockMvc.perform(post("/api/sync/tables/{table}", "photos-2024"))
                .andExpect(status().isBadRequest());

        verify(orchestrator, never()).syncTable(any(), eq(true));
        verify(orchestrator, never()).syncTable(any(), eq(false));
    }

    @Test
    @DisplayName("Should sync one table fully on request")
    void testSyncTable_Full() throws Exception {
        when(orchestrator.syncTable("photos", true)).thenReturn(pending("job-3", SyncMode.FULL));

        mockMvc.perform(post("/api/sync/tables/photos").param("full", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId").value("job-3"));
    }

    // ============================================================================
    // Jobs and checkpoints
    // ============================================================================

    @Test
    @DisplayName("Should answer 404 for an unknown job")
    void testJob_Unknown() throws Exception {
        when(orchestrator.getJob("nope")).thenThrow(new UnknownJobException("nope"));

        mockMvc.perform(get("/api/sync/jobs/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    @DisplayName("Should answer 503 when the source is unreachable")
    void testSchema_SourceDown() throws Exception {
        when(orchestrator.currentSchema()).thenThrow(new SourceConnectionException("Connection refused"));

        mockMvc.perform(get("/api/schema"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("Should cancel a job")
    void testCancel() throws Exception {
        when(orchestrator.cancel("job-1")).thenReturn(pending("job-1", SyncMode.FULL));

        mockMvc.perform(post("/api/sync/jobs/job-1/cancel"))
                .andExpect(status().isOk());

        verify(orchestrator).cancel("job-1");
    }

    @Test
    @DisplayName("Should reset one table or all checkpoints")
    void testResetCheckpoints() throws Exception {
        mockMvc.perform(delete("/api/sync/checkpoints/photos")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/sync/checkpoints")).andExpect(status().isNoContent());

        verify(orchestrator).resetCheckpoints(Optional.of("photos"));
        verify(orchestrator).resetCheckpoints(Optional.empty());
    }
}
