package com.watchtide.controller;

import com.watchtide.dto.IngestionResult;
import com.watchtide.model.IngestionStatus;
import com.watchtide.service.WebhookIngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class WebhookControllerTest {

    @Mock private WebhookIngestionService ingestionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new WebhookController(ingestionService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static IngestionResult result(IngestionStatus status, boolean duplicate) {
        return IngestionResult.builder().status(status).duplicate(duplicate).build();
    }

    @Test
    @DisplayName("Accepted mail push gets 204")
    void gmail_accepted_noContent() throws Exception {
        when(ingestionService.ingestGmailPush(any(HttpHeaders.class), eq("{\"message\":{}}")))
                .thenReturn(result(IngestionStatus.ENQUEUED, false));

        mockMvc.perform(post("/webhooks/gmail-push").contentType(MediaType.APPLICATION_JSON).content("{\"message\":{}}"))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("Rejected mail push gets 403")
    void gmail_rejected_forbidden() throws Exception {
        when(ingestionService.ingestGmailPush(any(HttpHeaders.class), anyString()))
                .thenReturn(IngestionResult.rejected("signature mismatch"));

        mockMvc.perform(post("/webhooks/gmail-push").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Internal failure on mail push still acknowledges")
    void gmail_failure_stillAcknowledged() throws Exception {
        when(ingestionService.ingestGmailPush(any(HttpHeaders.class), anyString()))
                .thenThrow(new IllegalStateException("unexpected"));

        mockMvc.perform(post("/webhooks/gmail-push").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("Calendar notification without body reaches ingestion with its headers")
    void calendar_accepted_ok() throws Exception {
        when(ingestionService.ingestCalendarNotification(any(HttpHeaders.class), eq("")))
                .thenReturn(result(IngestionStatus.ENQUEUED, false));

        mockMvc.perform(post("/webhooks/calendar")
                        .header("X-Goog-Channel-ID", "ch-1")
                        .header("X-Goog-Message-Number", "42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.dedup").doesNotExist());

        verify(ingestionService).ingestCalendarNotification(
                argThat(headers -> "ch-1".equals(headers.getFirst("x-goog-channel-id"))), eq(""));
    }

    @Test
    @DisplayName("Duplicate calendar notification is flagged")
    void calendar_duplicate_flagged() throws Exception {
        when(ingestionService.ingestCalendarNotification(any(HttpHeaders.class), anyString()))
                .thenReturn(result(IngestionStatus.ENQUEUED, true));

        mockMvc.perform(post("/webhooks/calendar"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.dedup").value(true));
    }

    @Test
    @DisplayName("Rejected calendar notification gets 403")
    void calendar_rejected_forbidden() throws Exception {
        when(ingestionService.ingestCalendarNotification(any(HttpHeaders.class), anyString()))
                .thenReturn(IngestionResult.rejected("channel token mismatch"));

        mockMvc.perform(post("/webhooks/calendar"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.ok").value(false));
    }

    @Test
    @DisplayName("Failed calendar notification still returns ok")
    void calendar_failed_stillOk() throws Exception {
        when(ingestionService.ingestCalendarNotification(any(HttpHeaders.class), anyString()))
                .thenReturn(result(IngestionStatus.FAILED, false));

        mockMvc.perform(post("/webhooks/calendar"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));
    }
}
