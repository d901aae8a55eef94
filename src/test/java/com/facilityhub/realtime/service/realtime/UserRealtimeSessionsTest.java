package com.facilityhub.realtime.service.realtime;

import com.facilityhub.realtime.client.impl.MockChangeFeedClient;
import com.facilityhub.realtime.config.RealtimeProperties;
import com.facilityhub.realtime.model.domain.ChangeEvent;
import com.facilityhub.realtime.service.cache.SpringCacheSynchronizer;
import com.facilityhub.realtime.service.notification.RecordingSseEmitter;
import com.facilityhub.realtime.service.notification.SseEventStream;
import com.facilityhub.realtime.service.routing.EscalationPolicy;
import com.facilityhub.realtime.service.routing.NotificationDurations;
import com.facilityhub.realtime.service.routing.RoutingTables;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@DisplayName("UserRealtimeSessions Tests")
class UserRealtimeSessionsTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final String USER = "user-42";

    private MockChangeFeedClient feed;
    private List<RecordingSseEmitter> emitters;
    private UserRealtimeSessions sessions;

    @BeforeEach
    void setUp() {
        feed = new MockChangeFeedClient();
        emitters = new CopyOnWriteArrayList<>();
        RealtimeProperties properties = new RealtimeProperties();
        properties.setShutdownTimeout(Duration.ofSeconds(1));
        SubscriptionManagerFactory factory = new SubscriptionManagerFactory(feed,
                new SpringCacheSynchronizer(new ConcurrentMapCacheManager()),
                RetryPolicy.linear(Duration.ofMillis(50), 3, Duration.ofMillis(500)),
                NotificationDurations.defaults(),
                Runnable::run,
                properties,
                new RealtimeMetrics(new SimpleMeterRegistry()));
        sessions = new UserRealtimeSessions(factory, RoutingTables.user(EscalationPolicy.defaults()),
                name -> new SseEventStream(name, () -> {
                    RecordingSseEmitter emitter = new RecordingSseEmitter();
                    emitters.add(emitter);
                    return emitter;
                }));
    }

    @AfterEach
    void tearDown() {
        sessions.closeAll();
    }

    private RecordingSseEmitter openSubscribed() {
        sessions.open(USER);
        await().atMost(WAIT).until(() -> feed.openSubscriptions(RealtimeChannels.USER_HUB) == 1);
        assertThat(sessions.openSessions(USER)).isEqualTo(1);
        return emitters.get(emitters.size() - 1);
    }

    private void assertSessionReleased() {
        assertThat(sessions.openSessions(USER)).isZero();
        assertThat(sessions.openSessions()).isZero();
        await().atMost(WAIT).until(() -> feed.openSubscriptions(RealtimeChannels.USER_HUB) == 0);
    }

    @Test
    @DisplayName("Completed stream stops the user's feed")
    void completedStream() {
        openSubscribed().fireCompletion();

        assertSessionReleased();
    }

    @Test
    @DisplayName("Timed out stream stops the user's feed")
    void timedOutStream() {
        openSubscribed().fireTimeout();

        assertSessionReleased();
    }

    @Test
    @DisplayName("Failed stream stops the user's feed")
    void failedStream() {
        openSubscribed().fireError(new IOException("Connection reset"));

        assertSessionReleased();
    }

    @Test
    @DisplayName("Stream whose client went away is released on the next push")
    void brokenPipe() {
        RecordingSseEmitter emitter = openSubscribed();
        emitter.breakPipe();

        feed.publish(ChangeEvent.update("key_requests",
                Map.of("user_id", USER, "status", "pending"),
                Map.of("user_id", USER, "status", "approved")));

        await().atMost(WAIT).until(() -> sessions.openSessions(USER) == 0);
        assertSessionReleased();

        // later container callbacks find nothing left to close
        emitter.fireError(new IOException("Broken pipe"));
        emitter.fireCompletion();
        assertThat(sessions.openSessions()).isZero();
    }

    @Test
    @DisplayName("Closing one stream leaves the user's other streams open")
    void closesOnlyItsOwnSession() {
        RecordingSseEmitter first = openSubscribed();
        sessions.open(USER);
        await().atMost(WAIT).until(() -> feed.openSubscriptions(RealtimeChannels.USER_HUB) == 2);

        first.fireCompletion();

        assertThat(sessions.openSessions(USER)).isEqualTo(1);
        await().atMost(WAIT).until(() -> feed.openSubscriptions(RealtimeChannels.USER_HUB) == 1);
    }

    @Test
    @DisplayName("Blank user id is rejected")
    void blankUser() {
        assertThatThrownBy(() -> sessions.open(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThat(sessions.openSessions()).isZero();
    }
}
