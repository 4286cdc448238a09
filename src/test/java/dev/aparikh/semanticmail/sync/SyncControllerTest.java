package dev.aparikh.semanticmail.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.semanticmail.api.SyncRequest;
import dev.aparikh.semanticmail.mailbox.MailboxCredentials;
import dev.aparikh.semanticmail.model.FilterReason;
import dev.aparikh.semanticmail.model.RunStatus;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = SyncController.class)
class SyncControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private SyncOrchestrator orchestrator;

    @Test
    void syncReturnsRunSummary() throws Exception {
        Instant from = Instant.parse("2025-01-01T00:00:00Z");
        SyncSummary summary = new SyncSummary("u1", from, 12, 4, 7, 1, 3, RunStatus.PARTIAL,
                Instant.parse("2025-01-05T10:00:00Z"), Map.of(FilterReason.MARKETING, 4));
        when(orchestrator.run(eq("u1"), any(MailboxCredentials.class), isNull())).thenReturn(summary);

        mockMvc.perform(post("/api/indexing/sync")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SyncRequest("u1", null))))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.emailsProcessed").value(12))
                .andExpect(jsonPath("$.fromDate").value("2025-01-01T00:00:00Z"))
                .andExpect(jsonPath("$.filtered").value(4))
                .andExpect(jsonPath("$.vectorized").value(7))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.skipped").value(3))
                .andExpect(jsonPath("$.status").value("PARTIAL"));

        ArgumentCaptor<MailboxCredentials> credentials = ArgumentCaptor.forClass(MailboxCredentials.class);
        verify(orchestrator).run(eq("u1"), credentials.capture(), isNull());
        assertThat(credentials.getValue().accessToken()).isEqualTo("token-1");
    }

    @Test
    void syncPassesFromDateOverride() throws Exception {
        Instant from = Instant.parse("2024-12-01T00:00:00Z");
        when(orchestrator.run(eq("u1"), any(MailboxCredentials.class), eq(from)))
                .thenReturn(new SyncSummary("u1", from, 0, 0, 0, 0, 0, RunStatus.SUCCESS, null, Map.of()));

        mockMvc.perform(post("/api/indexing/sync")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\",\"fromDate\":\"2024-12-01T00:00:00Z\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"));
    }

    @Test
    void syncWithoutAuthorizationHeaderIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/indexing/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

        verify(orchestrator, never()).run(any(), any(), any());
    }

    @Test
    void syncWithNonBearerHeaderIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/indexing/sync")
                        .header(HttpHeaders.AUTHORIZATION, "Basic dXNlcjpwYXNz")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_EXPIRED"));
    }

    @Test
    void syncWithoutUserIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/indexing/sync")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Validation failed: userId is required"));
    }

    @Test
    void concurrentSyncIsConflict() throws Exception {
        when(orchestrator.run(eq("u1"), any(MailboxCredentials.class), isNull()))
                .thenThrow(new SyncException(SyncException.Reason.ALREADY_RUNNING, "A sync is already running for u1"));

        mockMvc.perform(post("/api/indexing/sync")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_RUNNING"));
    }

    @Test
    void expiredMailboxTokenIsUnauthorized() throws Exception {
        when(orchestrator.run(eq("u1"), any(MailboxCredentials.class), isNull()))
                .thenThrow(new SyncException(SyncException.Reason.AUTH_EXPIRED, "Mailbox credentials expired"));

        mockMvc.perform(post("/api/indexing/sync")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_EXPIRED"));
    }

    @Test
    void dependencyOutageIsServiceUnavailable() throws Exception {
        when(orchestrator.run(eq("u1"), any(MailboxCredentials.class), isNull()))
                .thenThrow(new SyncException(SyncException.Reason.STORE_UNAVAILABLE, "Failed to save emails"));

        mockMvc.perform(post("/api/indexing/sync")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"));
    }

    @Test
    void stateReportsCurrentStage() throws Exception {
        when(orchestrator.currentState("u1")).thenReturn(SyncState.EMBEDDING);

        mockMvc.perform(get("/api/indexing/state").param("userId", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("EMBEDDING"));
    }

    @Test
    void stateWithoutUserIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/indexing/state"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }
}
