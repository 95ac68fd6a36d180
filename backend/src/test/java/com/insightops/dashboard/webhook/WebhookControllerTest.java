package com.insightops.dashboard.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightops.dashboard.MutableClock;
import com.insightops.dashboard.cache.TenantCache;
import com.insightops.dashboard.config.DashboardProperties;
import com.insightops.dashboard.tenant.Tenant;
import com.insightops.dashboard.tenant.TenantDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link WebhookController}, wired to a real duplicate filter,
 * event handler and cache.
 */
class WebhookControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MutableClock clock;
    private TenantCache tenantCache;
    private WebhookEventHandler eventHandler;
    private WebhookController controller;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        DashboardProperties properties = new DashboardProperties();
        TenantDirectory tenantDirectory = Mockito.mock(TenantDirectory.class);
        when(tenantDirectory.getTenantWithCredentials("contoso"))
                .thenReturn(Optional.of(Tenant.builder().id("contoso").build()));
        when(tenantDirectory.getTenantWithCredentials("fabrikam"))
                .thenReturn(Optional.of(Tenant.builder().id("fabrikam").active(false).build()));
        when(tenantDirectory.getTenantWithCredentials("ghost")).thenReturn(Optional.empty());

        tenantCache = new TenantCache(properties, clock);
        eventHandler = new WebhookEventHandler(tenantCache);
        controller = new WebhookController(tenantDirectory,
                new DuplicateEventFilter(properties, clock), eventHandler, clock);
    }

    @Nested
    @DisplayName("Organization-scoped routes")
    class OrganizationRoutes {

        @Test
        @DisplayName("A first delivery evicts the affected cache entries of that tenant only")
        void firstDeliveryEvicts() throws Exception {
            tenantCache.set("contoso", "workItems:Payments", "cached");
            tenantCache.set("contoso", "overdueWorkItems:Payments", "cached");
            tenantCache.set("contoso", "pullRequests:Payments", "cached");
            tenantCache.set("fabrikam", "workItems:Web", "cached");

            ResponseEntity<Map<String, Object>> response = controller.receive("contoso", "workitem", "updated",
                    payload("{\"id\":\"evt-1\",\"eventType\":\"workitem.updated\",\"resource\":{\"id\":42}}"));

            assertEquals(HttpStatus.OK, response.getStatusCode());
            assertEquals("Webhook processed", response.getBody().get("message"));
            assertEquals(2, response.getBody().get("evictedEntries"));
            assertTrue(tenantCache.get("contoso", "workItems:Payments").isEmpty());
            assertTrue(tenantCache.get("contoso", "overdueWorkItems:Payments").isEmpty());
            assertTrue(tenantCache.get("contoso", "pullRequests:Payments").isPresent());
            assertTrue(tenantCache.get("fabrikam", "workItems:Web").isPresent());
        }

        @Test
        @DisplayName("A redelivery inside the window is acknowledged but not processed")
        void redeliveryIsIgnored() throws Exception {
            JsonNode body = payload("{\"id\":\"evt-2\",\"eventType\":\"git.pullrequest.created\"}");
            controller.receive("contoso", "pullrequest", "created", body);
            tenantCache.set("contoso", "pullRequests:Payments", "refetched");
            clock.advanceSeconds(5);

            ResponseEntity<Map<String, Object>> response = controller.receive("contoso", "pullrequest", "created", body);

            assertEquals(HttpStatus.OK, response.getStatusCode());
            assertEquals("Duplicate webhook ignored", response.getBody().get("message"));
            assertEquals(5000L, response.getBody().get("timeSinceLastProcessed"));
            assertTrue(tenantCache.get("contoso", "pullRequests:Payments").isPresent());
        }

        @Test
        @DisplayName("The event id falls back to resource.id and the event type to the route default")
        void fallbacks() throws Exception {
            ResponseEntity<Map<String, Object>> response = controller.receive("contoso", "build", "completed",
                    payload("{\"resource\":{\"id\":987}}"));

            assertEquals("987", response.getBody().get("eventId"));
            assertEquals("build.complete", response.getBody().get("eventType"));
        }

        @Test
        @DisplayName("Unknown, inactive and unidentifiable deliveries are rejected")
        void rejections() throws Exception {
            JsonNode body = payload("{\"id\":\"evt-3\"}");

            assertRejected(controller.receive("contoso", "wiki", "updated", body),
                    HttpStatus.NOT_FOUND, "UNKNOWN_WEBHOOK");
            assertRejected(controller.receive("ghost", "workitem", "created", body),
                    HttpStatus.NOT_FOUND, "ORGANIZATION_VALIDATION_FAILED");
            assertRejected(controller.receive("fabrikam", "workitem", "created", body),
                    HttpStatus.GONE, "ORGANIZATION_VALIDATION_FAILED");
            assertRejected(controller.receive("contoso", "workitem", "created", payload("{\"resource\":{}}")),
                    HttpStatus.BAD_REQUEST, "MISSING_EVENT_ID");
            assertRejected(controller.receive("contoso", "workitem", "created", null),
                    HttpStatus.BAD_REQUEST, "MISSING_EVENT_ID");
        }
    }

    @Test
    @DisplayName("Routes without an organization are gone")
    void legacyRoutesAreGone() {
        assertRejected(controller.rejectUserWebhook("user-1", "workitem", "created"),
                HttpStatus.GONE, "LEGACY_WEBHOOK_REMOVED");
        assertRejected(controller.rejectGlobalWebhook("release", "deployment"),
                HttpStatus.GONE, "LEGACY_WEBHOOK_REMOVED");
        assertRejected(controller.rejectGlobalWebhook("wiki", "updated"),
                HttpStatus.NOT_FOUND, "UNKNOWN_WEBHOOK");
    }

    @Test
    @DisplayName("eventId() ignores blank ids")
    void eventIdParsing() throws Exception {
        assertNull(WebhookController.eventId(payload("{\"id\":\"  \"}")));
        assertEquals("7", WebhookController.eventId(payload("{\"id\":\" \",\"resource\":{\"id\":7}}")));
    }

    @Test
    @DisplayName("Health reports the webhook service")
    void health() {
        Map<String, Object> body = controller.health();

        assertEquals("healthy", body.get("status"));
        assertEquals("2025-03-01T10:00:00Z", body.get("timestamp"));
    }

    private JsonNode payload(String json) throws Exception {
        return objectMapper.readTree(json);
    }

    private static void assertRejected(ResponseEntity<Map<String, Object>> response, HttpStatus status, String code) {
        assertEquals(status, response.getStatusCode());
        assertEquals(code, response.getBody().get("code"));
    }
}
