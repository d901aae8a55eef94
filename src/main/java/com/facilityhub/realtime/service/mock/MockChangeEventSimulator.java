package com.facilityhub.realtime.service.mock;

import com.facilityhub.realtime.client.impl.MockChangeFeedClient;
import com.facilityhub.realtime.model.domain.ChangeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Replays a short script of realistic dashboard mutations through the
 * in-memory feed so the demo profile shows alerts without a database.
 */
@Slf4j
@Service
@Profile("demo")
@RequiredArgsConstructor
public class MockChangeEventSimulator {

    static final String DEMO_USER = "7f3c2a10-demo-user";

    private final MockChangeFeedClient feed;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        Thread simulator = new Thread(() -> simulate(2000, 1500), "realtime-demo-simulator");
        simulator.setDaemon(true);
        simulator.start();
    }

    /**
     * Publishes the whole script, pausing between events.
     *
     * @param initialDelayMs time for the feeds to subscribe
     * @param gapMs          pause between two events
     */
    public void simulate(long initialDelayMs, long gapMs) {
        log.info("=== Starting mock change event simulation ===");
        try {
            Thread.sleep(initialDelayMs);
            for (ChangeEvent event : script()) {
                log.info("MOCK - publishing {} on {}", event.operation(), event.table());
                feed.publish(event);
                Thread.sleep(gapMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Mock change event simulation interrupted");
            return;
        }
        log.info("=== Mock change event simulation complete ===");
    }

    List<ChangeEvent> script() {
        return List.of(
                ChangeEvent.insert("admin_notifications", Map.of(
                        "id", "an-1001",
                        "notification_type", "new_key_request",
                        "title", "New key request",
                        "message", "Maria Lopez requested a key for room 1204",
                        "urgency", "medium",
                        "metadata", Map.of("action_url", "/admin/key-requests"))),
                ChangeEvent.insert("issues", Map.of(
                        "id", "iss-311",
                        "title", "Water leak in courtroom 4B",
                        "priority", "high",
                        "status", "open")),
                ChangeEvent.update("court_assignments",
                        Map.of("id", "ca-17", "part", "TAP-A", "justice", "Hon. R. Alvarez"),
                        Map.of("id", "ca-17", "part", "TAP-A", "justice", "Hon. K. Chen")),
                ChangeEvent.insert("court_attendance", Map.of(
                        "id", "att-88",
                        "room_id", "rm-4b",
                        "status", "present")),
                ChangeEvent.update("issues",
                        Map.of("id", "iss-311", "title", "Water leak in courtroom 4B", "status", "in_progress"),
                        Map.of("id", "iss-311", "title", "Water leak in courtroom 4B", "status", "resolved")),
                ChangeEvent.update("key_requests",
                        Map.of("id", "kr-52", "user_id", DEMO_USER, "status", "pending"),
                        Map.of("id", "kr-52", "user_id", DEMO_USER, "status", "approved")),
                ChangeEvent.insert("room_assignments", Map.of(
                        "id", "ra-9",
                        "occupant_id", DEMO_USER,
                        "room_id", "rm-1204",
                        "is_primary", true)));
    }
}
