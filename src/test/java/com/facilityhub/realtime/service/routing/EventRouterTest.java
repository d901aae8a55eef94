package com.facilityhub.realtime.service.routing;

import com.facilityhub.realtime.model.domain.ChangeEvent;
import com.facilityhub.realtime.model.domain.NotificationDescriptor;
import com.facilityhub.realtime.model.domain.Operation;
import com.facilityhub.realtime.model.domain.RoutedAction;
import com.facilityhub.realtime.model.domain.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EventRouter Tests")
class EventRouterTest {

    private final EventRouter admin = new EventRouter(RoutingTables.admin(EscalationPolicy.defaults()),
            NotificationDurations.defaults());
    private final EventRouter user = new EventRouter(RoutingTables.user(EscalationPolicy.defaults()),
            NotificationDurations.defaults());

    @Nested
    @DisplayName("Admin feed")
    class AdminFeed {

        @Test
        @DisplayName("High priority issue raises a critical error alert and refreshes the issue views")
        void highPriorityIssue() {
            ChangeEvent event = ChangeEvent.insert("issues",
                    Map.of("id", "iss-1", "title", "Water leak", "priority", "high"));

            RoutedAction action = admin.route(event);

            assertThat(action.notification()).isNotNull();
            assertThat(action.notification().severity()).isEqualTo(Severity.ERROR);
            assertThat(action.notification().durationMs()).isGreaterThanOrEqualTo(10000);
            assertThat(action.notification().message()).contains("Water leak");
            assertThat(action.invalidationKeys()).contains(RoutingTables.ISSUES, RoutingTables.ADMIN_NOTIFICATIONS);
        }

        @Test
        @DisplayName("Normal priority issue raises a warning")
        void normalPriorityIssue() {
            RoutedAction action = admin.route(ChangeEvent.insert("issues",
                    Map.of("title", "Flickering light", "priority", "low")));

            assertThat(action.notification().severity()).isEqualTo(Severity.WARNING);
            assertThat(action.notification().durationMs()).isEqualTo(8000);
            assertThat(action.notification().navigateTo()).isEqualTo("/admin/issues");
        }

        @Test
        @DisplayName("Judge reassignment names both judges")
        void judgeReassignment() {
            ChangeEvent event = ChangeEvent.update("court_assignments",
                    Map.of("part", "TAP-A", "justice", "Hon. Alvarez"),
                    Map.of("part", "TAP-A", "justice", "Hon. Chen"));

            RoutedAction action = admin.route(event);

            NotificationDescriptor notification = action.notification();
            assertThat(notification.severity()).isEqualTo(Severity.WARNING);
            assertThat(notification.title()).isEqualTo("Judge Reassigned");
            assertThat(notification.message()).contains("Hon. Alvarez", "Hon. Chen", "TAP-A");
            assertThat(action.invalidationKeys()).contains("court-assignments-table", "court-personnel");
        }

        @Test
        @DisplayName("Missing judge falls back to Unassigned")
        void judgeAssignedToEmptyPart() {
            Map<String, Object> before = new HashMap<>();
            before.put("part", "IAS-12");
            before.put("justice", null);

            RoutedAction action = admin.route(ChangeEvent.update("court_assignments", before,
                    Map.of("part", "IAS-12", "justice", "Hon. Chen")));

            assertThat(action.notification().message()).isEqualTo("Part IAS-12: Unassigned → Hon. Chen");
        }

        @Test
        @DisplayName("Staff change without a judge change is informational")
        void staffChange() {
            RoutedAction action = admin.route(ChangeEvent.update("court_assignments",
                    Map.of("justice", "Hon. Chen", "clerks", List.of("A")),
                    Map.of("justice", "Hon. Chen", "clerks", List.of("A", "B"))));

            assertThat(action.notification().severity()).isEqualTo(Severity.INFO);
            assertThat(action.notification().title()).isEqualTo("Court Staff Updated");
        }

        @Test
        @DisplayName("Benign court assignment update refreshes views silently")
        void benignCourtAssignmentUpdate() {
            RoutedAction action = admin.route(ChangeEvent.update("court_assignments",
                    Map.of("justice", "Hon. Chen", "calendar_day", "Mon"),
                    Map.of("justice", "Hon. Chen", "calendar_day", "Tue")));

            assertThat(action.notification()).isNull();
            assertThat(action.invalidationKeys()).containsExactlyInAnyOrder(
                    "court-assignments-enhanced", "court-assignments-table", "court-personnel",
                    "interactive-operations", "quick-actions", "assignment-stats");
        }

        @Test
        @DisplayName("Issue resolution is announced only on the transition")
        void issueResolved() {
            RoutedAction resolved = admin.route(ChangeEvent.update("issues",
                    Map.of("title", "Leak", "status", "in_progress"),
                    Map.of("title", "Leak", "status", "resolved")));
            RoutedAction stillResolved = admin.route(ChangeEvent.update("issues",
                    Map.of("title", "Leak", "status", "resolved"),
                    Map.of("title", "Leak (edited)", "status", "resolved")));

            assertThat(resolved.notification().severity()).isEqualTo(Severity.SUCCESS);
            assertThat(resolved.notification().title()).isEqualTo("Issue Resolved");
            assertThat(stillResolved.notification()).isNull();
            assertThat(stillResolved.invalidationKeys()).contains(RoutingTables.ISSUES);
        }

        @Test
        @DisplayName("Admin notification takes its icon and route from the row")
        void adminNotificationFromRow() {
            RoutedAction action = admin.route(ChangeEvent.insert("admin_notifications", Map.of(
                    "title", "New key request",
                    "message", "Room 1204",
                    "notification_type", "new_key_request",
                    "metadata", Map.of("action_url", "/admin/key-requests"))));

            NotificationDescriptor notification = action.notification();
            assertThat(notification.severity()).isEqualTo(Severity.INFO);
            assertThat(notification.title()).isEqualTo("New key request");
            assertThat(notification.icon()).isEqualTo("🔑");
            assertThat(notification.navigateTo()).isEqualTo("/admin/key-requests");
            assertThat(notification.actionLabel()).isEqualTo("View");
            assertThat(action.invalidationKeys()).containsExactly(RoutingTables.ADMIN_NOTIFICATIONS);
        }

        @Test
        @DisplayName("Admin notification without metadata falls back to the admin page and default icon")
        void adminNotificationDefaults() {
            RoutedAction action = admin.route(ChangeEvent.insert("admin_notifications", Map.of(
                    "title", "Something happened",
                    "message", "Details",
                    "notification_type", "unheard_of",
                    "urgency", "high")));

            assertThat(action.notification().severity()).isEqualTo(Severity.ERROR);
            assertThat(action.notification().durationMs()).isEqualTo(10000);
            assertThat(action.notification().icon()).isEqualTo("📋");
            assertThat(action.notification().navigateTo()).isEqualTo("/admin");
        }

        @Test
        @DisplayName("Court operations tables only invalidate")
        void courtOperationsAreSilent() {
            RoutedAction action = admin.route(ChangeEvent.delete("coverage_assignments", Map.of("id", "c-1")));

            assertThat(action.hasNotification()).isFalse();
            assertThat(action.invalidationKeys())
                    .containsExactly("coverage-assignments", "court-sessions", "conflict-detection");
        }
    }

    @Nested
    @DisplayName("User feed")
    class UserFeed {

        @Test
        @DisplayName("Approved key request is announced to its requester")
        void keyRequestApproved() {
            RoutedAction action = user.route(ChangeEvent.update("key_requests",
                    Map.of("status", "pending"), Map.of("status", "approved")));

            assertThat(action.notification().severity()).isEqualTo(Severity.SUCCESS);
            assertThat(action.notification().durationMs()).isEqualTo(4000);
            assertThat(action.invalidationKeys()).containsExactly("my-requests");
        }

        @Test
        @DisplayName("Primary room assignment gets its own message")
        void primaryRoomAssignment() {
            RoutedAction primary = user.route(ChangeEvent.insert("room_assignments", Map.of("is_primary", true)));
            RoutedAction secondary = user.route(ChangeEvent.insert("room_assignments", Map.of("is_primary", false)));

            assertThat(primary.notification().message()).contains("primary office");
            assertThat(secondary.notification().message()).contains("new room");
        }

        @Test
        @DisplayName("Medium urgency user notification is brief and informational")
        void mediumUrgencyNotification() {
            RoutedAction action = user.route(ChangeEvent.insert("user_notifications", Map.of(
                    "title", "Heads up", "message", "Elevator maintenance", "urgency", "medium",
                    "action_url", "/notifications")));

            assertThat(action.notification().severity()).isEqualTo(Severity.INFO);
            assertThat(action.notification().navigateTo()).isEqualTo("/notifications");
        }

        @Test
        @DisplayName("Notification without a route has no action")
        void notificationWithoutRoute() {
            RoutedAction action = user.route(ChangeEvent.insert("user_notifications", Map.of(
                    "title", "Welcome", "message", "Hello")));

            assertThat(action.notification().severity()).isEqualTo(Severity.SUCCESS);
            assertThat(action.notification().hasAction()).isFalse();
        }
    }

    @Nested
    @DisplayName("Routing guarantees")
    class Guarantees {

        @Test
        @DisplayName("Same event and table always give the same action")
        void deterministic() {
            Map<String, Object> row = Map.of("title", "Leak", "priority", "high");
            ChangeEvent early = new ChangeEvent("issues", Operation.INSERT, null, row, Instant.EPOCH);
            ChangeEvent late = new ChangeEvent("issues", Operation.INSERT, null, row, Instant.now());

            assertThat(admin.route(early)).isEqualTo(admin.route(late));
            assertThat(admin.route(early)).isEqualTo(admin.route(early));
        }

        @Test
        @DisplayName("Unknown table or operation yields an empty action")
        void total() {
            assertThat(admin.route(ChangeEvent.insert("parking_spots", Map.of("id", 1))).isEmpty()).isTrue();
            assertThat(admin.route(ChangeEvent.delete("issues", Map.of("id", 1))).isEmpty()).isTrue();
            assertThat(admin.route(null)).isEqualTo(RoutedAction.EMPTY);
            assertThat(admin.route(new ChangeEvent(null, null, null, null, Instant.now())))
                    .isEqualTo(RoutedAction.EMPTY);
        }

        @Test
        @DisplayName("A failing condition fails closed")
        void failsClosed() {
            RoutingTable table = RoutingTable.builder("broken")
                    .on("issues", "INSERT")
                        .when(event -> {
                            throw new IllegalStateException("boom");
                        }, NotificationTemplate.of(Severity.INFO, "x", "y", DurationTier.BRIEF))
                        .invalidate("issues")
                    .build();
            EventRouter router = new EventRouter(table, NotificationDurations.defaults());

            RoutedAction action = router.route(ChangeEvent.insert("issues", Map.of("id", 1)));

            assertThat(action).isEqualTo(RoutedAction.EMPTY);
        }

        @Test
        @DisplayName("Escalation fields and values come from configuration")
        void configurableEscalation() {
            EventRouter router = new EventRouter(
                    RoutingTables.admin(new EscalationPolicy(List.of("severity"), Set.of("CRITICAL"))),
                    NotificationDurations.defaults());

            RoutedAction configured = router.route(ChangeEvent.insert("issues",
                    Map.of("title", "Fire", "severity", "critical")));
            RoutedAction defaultField = router.route(ChangeEvent.insert("issues",
                    Map.of("title", "Fire", "priority", "high")));

            assertThat(configured.notification().severity()).isEqualTo(Severity.ERROR);
            assertThat(defaultField.notification().severity()).isEqualTo(Severity.WARNING);
        }

        @Test
        @DisplayName("Durations come from the configured tiers")
        void configurableDurations() {
            EventRouter router = new EventRouter(RoutingTables.admin(EscalationPolicy.defaults()),
                    new NotificationDurations(1000, 2000, 3000, 4000, 5000));

            RoutedAction action = router.route(ChangeEvent.insert("issues",
                    Map.of("title", "Fire", "priority", "high")));

            assertThat(action.notification().durationMs()).isEqualTo(5000);
        }
    }
}
