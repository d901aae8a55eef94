package com.facilityhub.realtime.service.notification;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Emitter that keeps the callbacks a servlet container would normally fire,
 * so tests can complete, time out or fail it without a running server.
 */
public class RecordingSseEmitter extends SseEmitter {

    private final List<Runnable> completionCallbacks = new CopyOnWriteArrayList<>();
    private final List<Runnable> timeoutCallbacks = new CopyOnWriteArrayList<>();
    private final List<Consumer<Throwable>> errorCallbacks = new CopyOnWriteArrayList<>();
    private volatile boolean brokenPipe;

    @Override
    public void onCompletion(Runnable callback) {
        super.onCompletion(callback);
        completionCallbacks.add(callback);
    }

    @Override
    public void onTimeout(Runnable callback) {
        super.onTimeout(callback);
        timeoutCallbacks.add(callback);
    }

    @Override
    public void onError(Consumer<Throwable> callback) {
        super.onError(callback);
        errorCallbacks.add(callback);
    }

    @Override
    public void send(SseEventBuilder builder) throws IOException {
        if (brokenPipe) {
            throw new IOException("Broken pipe");
        }
        super.send(builder);
    }

    public void breakPipe() {
        brokenPipe = true;
    }

    public void fireCompletion() {
        completionCallbacks.forEach(Runnable::run);
    }

    public void fireTimeout() {
        timeoutCallbacks.forEach(Runnable::run);
    }

    public void fireError(Throwable error) {
        errorCallbacks.forEach(callback -> callback.accept(error));
    }
}
