package com.facilityhub.realtime.service.notification;

import com.facilityhub.realtime.model.domain.NotificationDescriptor;
import com.facilityhub.realtime.service.cache.CacheSynchronizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Pushes notifications and cache invalidations to connected browser sessions
 * as server-sent events named {@code notification} and {@code invalidate}.
 */
@Slf4j
public class SseEventStream implements NotificationSink, CacheSynchronizer {

    public static final String NOTIFICATION_EVENT = "notification";
    public static final String INVALIDATE_EVENT = "invalidate";

    private final String name;
    private final Supplier<SseEmitter> emitterFactory;
    // open emitters and the disconnect callback of each
    private final Map<SseEmitter, Runnable> emitters = new ConcurrentHashMap<>();

    public SseEventStream(String name, long timeoutMs) {
        this(name, () -> new SseEmitter(timeoutMs));
    }

    public SseEventStream(String name, Supplier<SseEmitter> emitterFactory) {
        this.name = name;
        this.emitterFactory = emitterFactory;
    }

    public SseEmitter connect() {
        return connect(() -> { });
    }

    /**
     * Registers a new emitter. {@code onDisconnect} runs exactly once, when the
     * emitter completes, times out, fails or can no longer be written to.
     */
    public SseEmitter connect(Runnable onDisconnect) {
        SseEmitter emitter = emitterFactory.get();
        emitters.put(emitter, onDisconnect);
        emitter.onCompletion(() -> disconnect(emitter));
        emitter.onTimeout(() -> disconnect(emitter));
        emitter.onError(e -> disconnect(emitter));
        log.debug("[{}] SSE client connected, {} open", name, emitters.size());
        return emitter;
    }

    @Override
    public void show(NotificationDescriptor notification) {
        broadcast(() -> SseEmitter.event().name(NOTIFICATION_EVENT).data(notification, MediaType.APPLICATION_JSON));
    }

    @Override
    public void invalidate(String key) {
        broadcast(() -> SseEmitter.event().name(INVALIDATE_EVENT).data(key));
    }

    public int connectedClients() {
        return emitters.size();
    }

    /**
     * Disconnects and completes every open emitter.
     */
    public void close() {
        for (SseEmitter emitter : List.copyOf(emitters.keySet())) {
            disconnect(emitter);
            emitter.complete();
        }
    }

    private void broadcast(Supplier<SseEmitter.SseEventBuilder> event) {
        for (SseEmitter emitter : emitters.keySet()) {
            try {
                emitter.send(event.get());
            } catch (IOException | IllegalStateException e) {
                // the container may never call back for a client that is already gone
                log.debug("[{}] Dropping SSE client: {}", name, e.getMessage());
                disconnect(emitter);
            }
        }
    }

    private void disconnect(SseEmitter emitter) {
        Runnable onDisconnect = emitters.remove(emitter);
        if (onDisconnect != null) {
            log.debug("[{}] SSE client disconnected, {} remaining", name, emitters.size());
            onDisconnect.run();
        }
    }
}
