package com.facilityhub.realtime.service.notification;

import com.facilityhub.realtime.model.domain.NotificationDescriptor;
import com.facilityhub.realtime.model.domain.Severity;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SseEventStreamTest {

    private final NotificationDescriptor alert =
            new NotificationDescriptor(Severity.INFO, "New Key Order", "Order #12 created", 6000, null, null, null);

    @Test
    void tracksConnectedClients() {
        SseEventStream stream = new SseEventStream("admin", 60_000);

        SseEmitter first = stream.connect();
        SseEmitter second = stream.connect();

        assertThat(first).isNotSameAs(second);
        assertThat(stream.connectedClients()).isEqualTo(2);
    }

    @Test
    void broadcastsBeforeTheClientIsAttached() {
        SseEventStream stream = new SseEventStream("admin", 60_000);
        stream.connect();

        assertThatCode(() -> {
            stream.show(alert);
            stream.invalidate("key-orders");
        }).doesNotThrowAnyException();
        assertThat(stream.connectedClients()).isEqualTo(1);
    }

    @Test
    void broadcastWithoutClientsDoesNothing() {
        SseEventStream stream = new SseEventStream("user-1", 60_000);

        assertThatCode(() -> stream.invalidate("my-requests")).doesNotThrowAnyException();
    }

    @Test
    void dropsClientsThatAlreadyCompleted() {
        SseEventStream stream = new SseEventStream("admin", 60_000);
        SseEmitter emitter = stream.connect();
        emitter.complete();

        stream.show(alert);

        assertThat(stream.connectedClients()).isZero();
    }

    @Test
    void closeCompletesEveryClient() {
        SseEventStream stream = new SseEventStream("admin", 60_000);
        stream.connect();
        stream.connect();

        stream.close();

        assertThat(stream.connectedClients()).isZero();
    }

    @Test
    void failedSendDisconnectsTheClientOnce() {
        RecordingSseEmitter emitter = new RecordingSseEmitter();
        SseEventStream stream = new SseEventStream("user-7", () -> emitter);
        AtomicInteger disconnects = new AtomicInteger();
        stream.connect(disconnects::incrementAndGet);
        emitter.breakPipe();

        stream.invalidate("my-requests");

        assertThat(stream.connectedClients()).isZero();
        assertThat(disconnects).hasValue(1);

        // the container reports the broken connection afterwards
        emitter.fireError(new IOException("Broken pipe"));
        emitter.fireCompletion();

        assertThat(disconnects).hasValue(1);
    }

    @Test
    void completedClientIsDisconnectedOnNextBroadcast() {
        SseEventStream stream = new SseEventStream("user-7", 60_000);
        AtomicInteger disconnects = new AtomicInteger();
        SseEmitter emitter = stream.connect(disconnects::incrementAndGet);
        emitter.complete();

        stream.show(alert);

        assertThat(disconnects).hasValue(1);
    }

    @Test
    void containerCallbacksDisconnectTheClient() {
        RecordingSseEmitter completed = new RecordingSseEmitter();
        RecordingSseEmitter timedOut = new RecordingSseEmitter();
        RecordingSseEmitter failed = new RecordingSseEmitter();
        Iterator<SseEmitter> next = List.<SseEmitter>of(completed, timedOut, failed).iterator();
        SseEventStream stream = new SseEventStream("admin", next::next);
        AtomicInteger disconnects = new AtomicInteger();
        stream.connect(disconnects::incrementAndGet);
        stream.connect(disconnects::incrementAndGet);
        stream.connect(disconnects::incrementAndGet);

        completed.fireCompletion();
        timedOut.fireTimeout();
        failed.fireError(new IllegalStateException("reset"));
        timedOut.fireCompletion();

        assertThat(disconnects).hasValue(3);
        assertThat(stream.connectedClients()).isZero();
    }

    @Test
    void closeRunsDisconnectCallbacks() {
        SseEventStream stream = new SseEventStream("admin", 60_000);
        AtomicInteger disconnects = new AtomicInteger();
        stream.connect(disconnects::incrementAndGet);
        stream.connect(disconnects::incrementAndGet);

        stream.close();
        stream.close();

        assertThat(disconnects).hasValue(2);
    }
}
