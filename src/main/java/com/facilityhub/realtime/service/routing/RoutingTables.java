package com.facilityhub.realtime.service.routing;

import java.util.Map;

import static com.facilityhub.realtime.model.domain.Severity.ERROR;
import static com.facilityhub.realtime.model.domain.Severity.INFO;
import static com.facilityhub.realtime.model.domain.Severity.SUCCESS;
import static com.facilityhub.realtime.model.domain.Severity.WARNING;
import static com.facilityhub.realtime.service.routing.DurationTier.BRIEF;
import static com.facilityhub.realtime.service.routing.DurationTier.CRITICAL;
import static com.facilityhub.realtime.service.routing.DurationTier.LONG;
import static com.facilityhub.realtime.service.routing.DurationTier.SHORT;
import static com.facilityhub.realtime.service.routing.DurationTier.STANDARD;
import static com.facilityhub.realtime.service.routing.NotificationTemplate.of;
import static com.facilityhub.realtime.service.routing.RowCondition.changedTo;
import static com.facilityhub.realtime.service.routing.RowCondition.escalated;
import static com.facilityhub.realtime.service.routing.RowCondition.fieldChanged;
import static com.facilityhub.realtime.service.routing.RowCondition.fieldEquals;

/**
 * The routing tables of the dashboard feeds.
 */
public final class RoutingTables {

    public static final String ADMIN_NOTIFICATIONS = "adminNotifications";
    public static final String ISSUES = "issues";

    private static final String[] COURT_ASSIGNMENT_VIEWS = {
            "court-assignments-enhanced", "court-assignments-table", "court-personnel",
            "interactive-operations", "quick-actions", "assignment-stats"
    };

    private static final Map<String, String> ADMIN_NOTIFICATION_ICONS = Map.of(
            "new_key_request", "🔑",
            "new_supply_request", "📦",
            "new_issue", "⚠️",
            "new_key_order", "🛒",
            "new_user_pending", "🆕",
            "user_approved", "✅",
            "user_rejected", "🚫",
            "role_assigned", "👤",
            "role_removed", "➖");

    private RoutingTables() {
    }

    /**
     * Routes for the admin dashboard: request and issue intake, user
     * registrations, court assignments and court operations.
     */
    public static RoutingTable admin(EscalationPolicy policy) {
        return RoutingTable.builder("admin")
                .on("admin_notifications", "INSERT")
                    .when(escalated(policy), of(ERROR, "{new.title}", "{new.message}", LONG)
                            .icon(IconLookup.byField("notification_type", ADMIN_NOTIFICATION_ICONS, "📋"))
                            .action("View", "{new.metadata.action_url|/admin}"))
                    .otherwise(of(INFO, "{new.title}", "{new.message}", SHORT)
                            .icon(IconLookup.byField("notification_type", ADMIN_NOTIFICATION_ICONS, "📋"))
                            .action("View", "{new.metadata.action_url|/admin}"))
                    .invalidate(ADMIN_NOTIFICATIONS)

                .on("key_requests", "INSERT")
                    .otherwise(of(INFO, "New Key Request", "Request for {new.request_type|a} key submitted", STANDARD)
                            .icon("🔑")
                            .action("Review Request", "/admin/key-requests"))
                    .invalidate(ADMIN_NOTIFICATIONS, "key-requests")
                .on("key_requests", "UPDATE")
                    .invalidate(ADMIN_NOTIFICATIONS, "key-requests")

                .on("supply_requests", "INSERT")
                    .when(escalated(policy), of(ERROR, "Urgent Supply Request",
                            "High priority request: \"{new.title}\"", LONG)
                            .icon("🚨")
                            .action("Review Now", "/admin/supply-requests"))
                    .otherwise(of(INFO, "New Supply Request", "Request: \"{new.title}\"", SHORT)
                            .icon("📦")
                            .action("Review Request", "/admin/supply-requests"))
                    .invalidate(ADMIN_NOTIFICATIONS, "supply-requests")

                .on("issues", "INSERT")
                    .when(escalated(policy), of(ERROR, "Critical Issue Reported",
                            "High severity: \"{new.title}\"", CRITICAL)
                            .icon("🚨")
                            .action("Address Now", "/admin/issues"))
                    .otherwise(of(WARNING, "New Issue Reported", "Issue: \"{new.title}\"", STANDARD)
                            .icon("⚠️")
                            .action("Review Issue", "/admin/issues"))
                    .invalidate(ADMIN_NOTIFICATIONS, ISSUES)
                .on("issues", "UPDATE")
                    .when(changedTo("status", "resolved"), of(SUCCESS, "Issue Resolved",
                            "\"{new.title}\" has been resolved.", SHORT)
                            .icon("✅")
                            .action("View", "/admin/issues"))
                    .invalidate(ADMIN_NOTIFICATIONS, ISSUES)

                .on("key_orders", "INSERT")
                    .otherwise(of(INFO, "New Key Order", "Order #{new.id} created", SHORT)
                            .icon("🛒")
                            .action("View", "/admin/key-orders"))
                    .invalidate(ADMIN_NOTIFICATIONS, "key-orders")
                .on("key_orders", "UPDATE")
                    .invalidate(ADMIN_NOTIFICATIONS, "key-orders")

                .on("profiles", "INSERT")
                    .otherwise(of(INFO, "New User Registration",
                            "A new user has registered and requires approval", STANDARD)
                            .icon("🆕")
                            .action("Review User", "/admin"))
                    .invalidate(ADMIN_NOTIFICATIONS, "users")
                .on("profiles", "UPDATE")
                    .invalidate(ADMIN_NOTIFICATIONS, "users")

                .on("court_assignments", "UPDATE")
                    .when(fieldChanged("justice"), of(WARNING, "Judge Reassigned",
                            "Part {new.part|?}: {old.justice|Unassigned} → {new.justice|Unassigned}", STANDARD)
                            .icon("⚖️")
                            .action("View Assignments", "/court-operations"))
                    .when(fieldChanged("clerks", "sergeant"), of(INFO, "Court Staff Updated",
                            "Staffing changed for part {new.part|?}", SHORT)
                            .action("View Assignments", "/court-operations"))
                    .invalidate(COURT_ASSIGNMENT_VIEWS)
                .on("court_assignments", "INSERT", "DELETE")
                    .invalidate(COURT_ASSIGNMENT_VIEWS)
                .on("court_rooms", "*")
                    .invalidate("court-assignments-table", "court-rooms")

                .on("court_activity_log", "INSERT")
                    .invalidate("court-activity")
                .on("court_attendance", "INSERT", "UPDATE")
                    .invalidate("court-attendance", "court-rooms")
                .on("court_room_status", "INSERT", "UPDATE")
                    .invalidate("court-status")
                .on("court_sessions", "*")
                    .invalidate("court-sessions", "conflict-detection")
                .on("coverage_assignments", "*")
                    .invalidate("coverage-assignments", "court-sessions", "conflict-detection")
                .build();
    }

    /**
     * Routes for an end user's own requests, issues and room assignments. Rows
     * are already filtered to the user by the channel.
     */
    public static RoutingTable user(EscalationPolicy policy) {
        return RoutingTable.builder("user")
                .on("user_notifications", "INSERT")
                    .when(escalated(policy), of(ERROR, "{new.title}", "{new.message}", STANDARD)
                            .action("View", "{new.action_url}"))
                    .when(fieldEquals("urgency", "medium"), of(INFO, "{new.title}", "{new.message}", BRIEF)
                            .action("View", "{new.action_url}"))
                    .otherwise(of(SUCCESS, "{new.title}", "{new.message}", BRIEF)
                            .action("View", "{new.action_url}"))
                    .invalidate("user-notifications")

                .on("key_requests", "UPDATE")
                    .when(changedTo("status", "approved"), of(SUCCESS, "Key Request Approved",
                            "Your key request has been approved!", BRIEF)
                            .action("View Details", "/my-requests"))
                    .when(changedTo("status", "rejected"), of(ERROR, "Key Request Rejected",
                            "Your key request has been rejected.", BRIEF)
                            .action("View Details", "/my-requests"))
                    .when(changedTo("status", "fulfilled"), of(SUCCESS, "Key Ready",
                            "Your key is ready for pickup!", BRIEF)
                            .action("View Details", "/my-requests"))
                    .invalidate("my-requests")

                .on("key_orders", "UPDATE")
                    .when(changedTo("status", "ready_for_pickup"), of(SUCCESS, "Your key is ready for pickup!",
                            "Visit the facilities office with your ID", STANDARD)
                            .icon("🔑")
                            .action("View Order", "/my-requests"))
                    .invalidate("my-requests")

                .on("supply_requests", "UPDATE")
                    .when(changedTo("status", "approved"), of(SUCCESS, "Supply Request Approved",
                            "Supply request \"{new.title}\" has been approved!", BRIEF)
                            .action("View Details", "/my-requests"))
                    .when(changedTo("status", "rejected"), of(ERROR, "Supply Request Rejected",
                            "Supply request \"{new.title}\" has been rejected.", BRIEF)
                            .action("View Details", "/my-requests"))
                    .when(changedTo("status", "fulfilled"), of(SUCCESS, "Supply Request Fulfilled",
                            "Supply request \"{new.title}\" has been fulfilled!", BRIEF)
                            .action("View Details", "/my-requests"))
                    .when(changedTo("status", "under_review"), of(INFO, "Supply Request Under Review",
                            "Supply request \"{new.title}\" is now under review.", BRIEF)
                            .action("View Details", "/my-requests"))
                    .invalidate("my-requests")

                .on("issues", "UPDATE")
                    .when(changedTo("status", "resolved"), of(SUCCESS, "Issue Resolved",
                            "Issue #{new.issue_number} has been resolved!", BRIEF)
                            .action("Issues", "/operations?tab=issues&issue_id={new.id}"))
                    .when(changedTo("status", "in_progress"), of(INFO, "Issue In Progress",
                            "Issue #{new.issue_number} is now being worked on.", BRIEF)
                            .action("Issues", "/operations?tab=issues&issue_id={new.id}"))
                    .invalidate("my-issues")

                .on("room_assignments", "INSERT")
                    .when(fieldEquals("is_primary", true), of(SUCCESS, "New Room Assignment",
                            "You have been assigned a new primary office", BRIEF)
                            .icon("🏠")
                            .action("View Details", "/dashboard"))
                    .otherwise(of(SUCCESS, "New Room Assignment",
                            "You have been assigned to a new room", BRIEF)
                            .icon("🏠")
                            .action("View Details", "/dashboard"))
                    .invalidate("my-rooms")
                .on("room_assignments", "UPDATE")
                    .otherwise(of(INFO, "Room Assignment Updated",
                            "Your room assignment has been modified", BRIEF)
                            .icon("📋")
                            .action("View Details", "/dashboard"))
                    .invalidate("my-rooms")
                .build();
    }
}
