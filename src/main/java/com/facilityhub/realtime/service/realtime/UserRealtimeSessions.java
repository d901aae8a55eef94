package com.facilityhub.realtime.service.realtime;

import com.facilityhub.realtime.config.RealtimeProperties;
import com.facilityhub.realtime.service.notification.SseEventStream;
import com.facilityhub.realtime.service.routing.RoutingTable;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Personal feeds of connected end users. Every open SSE stream owns one
 * subscription manager that lives exactly as long as the stream.
 */
@Slf4j
@Service
public class UserRealtimeSessions {

    private final SubscriptionManagerFactory factory;
    private final RoutingTable userRoutingTable;
    private final Function<String, SseEventStream> streams;
    private final AtomicLong sessionIds = new AtomicLong();
    private final Map<Long, Session> sessions = new ConcurrentHashMap<>();

    @Autowired
    public UserRealtimeSessions(SubscriptionManagerFactory factory,
                                @Qualifier("userRoutingTable") RoutingTable userRoutingTable,
                                RealtimeProperties properties) {
        this(factory, userRoutingTable,
                name -> new SseEventStream(name, properties.getSseTimeout().toMillis()));
    }

    UserRealtimeSessions(SubscriptionManagerFactory factory,
                         RoutingTable userRoutingTable,
                         Function<String, SseEventStream> streams) {
        this.factory = factory;
        this.userRoutingTable = userRoutingTable;
        this.streams = streams;
    }

    public SseEmitter open(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        long id = sessionIds.incrementAndGet();
        String name = "user-" + id;
        SseEventStream stream = streams.apply(name);
        SubscriptionManager manager = factory.create(name, userRoutingTable, stream);
        Session session = new Session(userId, manager, stream);
        sessions.put(id, session);

        SseEmitter emitter = stream.connect(() -> close(id));
        manager.start(List.of(RealtimeChannels.user(userId)));
        log.info("Opened realtime session {} for user {}", id, userId);
        return emitter;
    }

    public int openSessions() {
        return sessions.size();
    }

    public long openSessions(String userId) {
        return sessions.values().stream().filter(s -> s.userId().equals(userId)).count();
    }

    @PreDestroy
    public void closeAll() {
        for (Map.Entry<Long, Session> entry : sessions.entrySet()) {
            close(entry.getKey());
            entry.getValue().stream().close();
        }
    }

    private void close(long id) {
        Session session = sessions.remove(id);
        if (session != null) {
            session.manager().stop();
            log.info("Closed realtime session {} for user {}", id, session.userId());
        }
    }

    private record Session(String userId, SubscriptionManager manager, SseEventStream stream) { }
}
