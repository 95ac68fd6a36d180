package com.insightops.dashboard.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.insightops.dashboard.tenant.Tenant;
import com.insightops.dashboard.tenant.TenantDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Organization-scoped Azure DevOps service hook endpoints.
 *
 * <p>Every event is validated against the tenant directory, then passed through the
 * {@link DuplicateEventFilter}; only first sightings reach the {@link WebhookEventHandler}.
 * Routes without an organization are rejected with 410 Gone.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    static final String LEGACY_MESSAGE = "Please update your webhook URLs to use organization-based endpoints: "
            + "/api/webhooks/org/{organizationId}/...";

    private final TenantDirectory tenantDirectory;
    private final DuplicateEventFilter duplicateEventFilter;
    private final WebhookEventHandler eventHandler;
    private final Clock clock;

    @PostMapping("/org/{organizationId}/{resource}/{action}")
    public ResponseEntity<Map<String, Object>> receive(@PathVariable String organizationId,
                                                       @PathVariable String resource,
                                                       @PathVariable String action,
                                                       @RequestBody(required = false) JsonNode payload) {
        Optional<WebhookEventKind> kind = WebhookEventKind.fromPath(resource, action);
        if (kind.isEmpty()) {
            log.warn("Unknown webhook route {}/{} for organization {}", resource, action, organizationId);
            return error(HttpStatus.NOT_FOUND, "Unknown webhook route " + resource + "/" + action, "UNKNOWN_WEBHOOK");
        }
        log.info("Org {} route hit for organization {}", kind.get().getRoute(), organizationId);

        Optional<Tenant> tenant = tenantDirectory.getTenantWithCredentials(organizationId);
        if (tenant.isEmpty()) {
            log.error("Webhook received for non-existent organization {}", organizationId);
            return error(HttpStatus.NOT_FOUND, "Organization not found", "ORGANIZATION_VALIDATION_FAILED");
        }
        if (!tenant.get().isActive()) {
            log.warn("Webhook received for inactive organization {}", organizationId);
            return error(HttpStatus.GONE,
                    "Organization is inactive. Webhooks are disabled for deactivated organizations.",
                    "ORGANIZATION_VALIDATION_FAILED");
        }

        String eventId = eventId(payload);
        if (eventId == null) {
            log.warn("Webhook {} for organization {} carries no event id", kind.get().getRoute(), organizationId);
            return error(HttpStatus.BAD_REQUEST, "Event id is required", "MISSING_EVENT_ID");
        }
        String eventType = textOrNull(payload.path("eventType"));
        if (eventType == null) {
            eventType = kind.get().getDefaultEventType();
        }

        DedupeResult dedupe = duplicateEventFilter.checkAndMark(organizationId, eventType, eventId);
        if (dedupe.isDuplicate()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message", "Duplicate webhook ignored");
            body.put("eventId", eventId);
            body.put("eventType", eventType);
            body.put("timeSinceLastProcessed", dedupe.getTimeSinceFirstSeen().toMillis());
            body.put("timestamp", clock.instant().toString());
            return ResponseEntity.ok(body);
        }

        int evicted = eventHandler.handle(organizationId, kind.get(), eventId, eventType, payload);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Webhook processed");
        body.put("eventId", eventId);
        body.put("eventType", eventType);
        body.put("evictedEntries", evicted);
        body.put("timestamp", clock.instant().toString());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{userId}/{resource}/{action}")
    public ResponseEntity<Map<String, Object>> rejectUserWebhook(@PathVariable String userId,
                                                                 @PathVariable String resource,
                                                                 @PathVariable String action) {
        if (WebhookEventKind.fromPath(resource, action).isEmpty()) {
            return error(HttpStatus.NOT_FOUND, "Unknown webhook route " + resource + "/" + action, "UNKNOWN_WEBHOOK");
        }
        log.error("Rejected legacy user-based webhook {}/{} for user {}", resource, action, userId);
        return legacyRejection("User-based webhooks are no longer supported");
    }

    @PostMapping("/{resource}/{action}")
    public ResponseEntity<Map<String, Object>> rejectGlobalWebhook(@PathVariable String resource,
                                                                   @PathVariable String action) {
        if (WebhookEventKind.fromPath(resource, action).isEmpty()) {
            return error(HttpStatus.NOT_FOUND, "Unknown webhook route " + resource + "/" + action, "UNKNOWN_WEBHOOK");
        }
        log.error("Rejected legacy global webhook {}/{} without organization context", resource, action);
        return legacyRejection("Global webhooks are no longer supported");
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", "webhooks");
        body.put("timestamp", clock.instant().toString());
        return body;
    }

    /** Payload {@code id}, falling back to {@code resource.id}. */
    static String eventId(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        String id = textOrNull(payload.path("id"));
        return id != null ? id : textOrNull(payload.path("resource").path("id"));
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private ResponseEntity<Map<String, Object>> legacyRejection(String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", LEGACY_MESSAGE);
        body.put("code", "LEGACY_WEBHOOK_REMOVED");
        return ResponseEntity.status(HttpStatus.GONE).body(body);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String code) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("code", code);
        return ResponseEntity.status(status).body(body);
    }
}
