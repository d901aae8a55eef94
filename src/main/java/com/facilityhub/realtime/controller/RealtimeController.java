package com.facilityhub.realtime.controller;

import com.facilityhub.realtime.model.domain.ManagerStatus;
import com.facilityhub.realtime.service.realtime.AdminRealtimeFeed;
import com.facilityhub.realtime.service.realtime.UserRealtimeSessions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * Status, recovery and server-sent event streams of the realtime layer.
 */
@Slf4j
@RestController
@RequestMapping("/api/realtime")
public class RealtimeController {

    private final ObjectProvider<AdminRealtimeFeed> adminFeed;
    private final UserRealtimeSessions userSessions;

    public RealtimeController(ObjectProvider<AdminRealtimeFeed> adminFeed, UserRealtimeSessions userSessions) {
        this.adminFeed = adminFeed;
        this.userSessions = userSessions;
    }

    @GetMapping("/status")
    public ResponseEntity<ManagerStatus> status() {
        AdminRealtimeFeed feed = adminFeed.getIfAvailable();
        return ResponseEntity.ok(feed == null ? ManagerStatus.EMPTY : feed.status());
    }

    @PostMapping("/channels/{name}/restart")
    public ResponseEntity<Map<String, String>> restart(@PathVariable String name) {
        log.info("Restart requested for channel {}", name);
        try {
            requireAdminFeed().restart(name);
            return ResponseEntity.accepted().body(Map.of("channel", name, "status", "restarting"));
        } catch (IllegalArgumentException e) {
            log.warn("Restart rejected: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            log.warn("Restart rejected: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @GetMapping(path = "/admin/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter adminStream() {
        return requireAdminFeed().connect();
    }

    @GetMapping(path = "/users/{userId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter userStream(@PathVariable String userId) {
        return userSessions.open(userId);
    }

    @GetMapping("/users/sessions")
    public Map<String, Integer> userSessions() {
        return Map.of("open", userSessions.openSessions());
    }

    private AdminRealtimeFeed requireAdminFeed() {
        AdminRealtimeFeed feed = adminFeed.getIfAvailable();
        if (feed == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Admin realtime feed is disabled");
        }
        return feed;
    }
}
