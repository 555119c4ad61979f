package com.watchtide.controller;

import com.watchtide.dto.IngestionResult;
import com.watchtide.service.WebhookIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider callback endpoints.
 *
 * POST /webhooks/gmail-push  Pub/Sub push, 204 on anything but an authenticity failure
 * POST /webhooks/calendar    channel notification, 200 {"ok": true[, "dedup": true]}
 *
 * Authenticity failures get 403. Internal failures still get a 2xx: the
 * dedup decision is already made locally and provider retries would only
 * add load.
 */
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final WebhookIngestionService ingestionService;

    @PostMapping("/gmail-push")
    public ResponseEntity<Void> gmailPush(@RequestHeader HttpHeaders headers,
                                          @RequestBody(required = false) String body) {
        try {
            IngestionResult result = ingestionService.ingestGmailPush(headers, body == null ? "" : body);
            if (result.isRejected()) {
                return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
            }
        } catch (RuntimeException e) {
            log.error("Mail push handling failed: {}", e.getMessage(), e);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/calendar")
    public ResponseEntity<Map<String, Object>> calendarNotification(@RequestHeader HttpHeaders headers,
                                                                    @RequestBody(required = false) String body) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            IngestionResult result = ingestionService.ingestCalendarNotification(headers, body == null ? "" : body);
            if (result.isRejected()) {
                response.put("ok", false);
                return ResponseEntity.status(HttpStatus.FORBIDDEN).body(response);
            }
            response.put("ok", true);
            if (result.isDuplicate()) {
                response.put("dedup", true);
            }
        } catch (RuntimeException e) {
            log.error("Calendar notification handling failed: {}", e.getMessage(), e);
            response.put("ok", true);
        }
        return ResponseEntity.ok(response);
    }
}
