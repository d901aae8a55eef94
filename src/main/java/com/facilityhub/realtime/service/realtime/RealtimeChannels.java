package com.facilityhub.realtime.service.realtime;

import com.facilityhub.realtime.model.domain.ChannelSpec;
import com.facilityhub.realtime.model.domain.RowFilter;
import com.facilityhub.realtime.model.domain.TopicSpec;

import java.util.List;

import static com.facilityhub.realtime.model.domain.Operation.DELETE;
import static com.facilityhub.realtime.model.domain.Operation.INSERT;
import static com.facilityhub.realtime.model.domain.Operation.UPDATE;

/**
 * Channel layouts of the admin and user feeds.
 */
public final class RealtimeChannels {

    public static final String ADMIN_HUB = "admin-realtime-hub";
    public static final String COURT_OPS = "court-ops-changes";
    public static final String COURT_ASSIGNMENTS = "court-assignments";
    public static final String USER_HUB = "user-realtime-hub";

    private RealtimeChannels() {
    }

    public static List<ChannelSpec> admin() {
        return List.of(
                ChannelSpec.of(ADMIN_HUB,
                        TopicSpec.of("admin_notifications", INSERT),
                        TopicSpec.of("key_requests", INSERT, UPDATE),
                        TopicSpec.of("supply_requests", INSERT),
                        TopicSpec.of("issues", INSERT, UPDATE),
                        TopicSpec.of("key_orders", INSERT, UPDATE),
                        TopicSpec.of("profiles", INSERT, UPDATE)),
                ChannelSpec.of(COURT_OPS,
                        TopicSpec.of("court_activity_log", INSERT),
                        TopicSpec.of("court_attendance", INSERT, UPDATE),
                        TopicSpec.of("court_room_status", INSERT, UPDATE),
                        TopicSpec.all("court_sessions"),
                        TopicSpec.all("coverage_assignments")),
                ChannelSpec.of(COURT_ASSIGNMENTS,
                        TopicSpec.of("court_assignments", INSERT, UPDATE, DELETE),
                        TopicSpec.all("court_rooms")));
    }

    /**
     * The personal feed of one user: only rows that user owns.
     */
    public static ChannelSpec user(String userId) {
        return ChannelSpec.of(USER_HUB,
                TopicSpec.of("user_notifications", INSERT).filteredBy(RowFilter.eq("user_id", userId)),
                TopicSpec.of("key_requests", UPDATE).filteredBy(RowFilter.eq("user_id", userId)),
                TopicSpec.of("key_orders", UPDATE).filteredBy(RowFilter.eq("user_id", userId)),
                TopicSpec.of("supply_requests", UPDATE).filteredBy(RowFilter.eq("requester_id", userId)),
                TopicSpec.of("issues", UPDATE).filteredBy(RowFilter.eq("reported_by", userId)),
                TopicSpec.of("room_assignments", INSERT, UPDATE).filteredBy(RowFilter.eq("occupant_id", userId)));
    }
}
