package com.facilityhub.realtime.service.notification;

import com.facilityhub.realtime.model.domain.NotificationDescriptor;
import com.facilityhub.realtime.model.domain.Severity;
import com.facilityhub.realtime.service.realtime.RealtimeMetrics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    @Mock
    private NotificationSink sink;

    @Mock
    private RealtimeMetrics metrics;

    private final NotificationDescriptor alert =
            new NotificationDescriptor(Severity.WARNING, "Judge Reassigned", "Part TAP-A", 8000, "/court-operations",
                    "⚖️", "View Assignments");

    @Test
    void showsNotificationOnTheExecutor() {
        NotificationDispatcher dispatcher = new NotificationDispatcher(sink, Runnable::run, metrics);

        dispatcher.dispatch(alert);

        verify(sink).show(alert);
        assertThat(dispatcher.lastNotification()).contains(alert);
    }

    @Test
    void doesNotRunTheSinkOnTheCallerWhenTheExecutorIsDeferred() {
        Executor parked = command -> { };
        NotificationDispatcher dispatcher = new NotificationDispatcher(sink, parked, metrics);

        dispatcher.dispatch(alert);

        verify(sink, never()).show(any());
        assertThat(dispatcher.lastNotification()).contains(alert);
    }

    @Test
    void repeatedEventsAreNotDeduplicated() {
        NotificationDispatcher dispatcher = new NotificationDispatcher(sink, Runnable::run, metrics);

        dispatcher.dispatch(alert);
        dispatcher.dispatch(alert);

        verify(sink, times(2)).show(alert);
    }

    @Test
    void sinkFailureIsSwallowedAndCounted() {
        doThrow(new IllegalStateException("no toast container")).when(sink).show(alert);
        NotificationDispatcher dispatcher = new NotificationDispatcher(sink, Runnable::run, metrics);

        assertThatCode(() -> dispatcher.dispatch(alert)).doesNotThrowAnyException();

        verify(metrics).recordDispatchFailure();
    }

    @Test
    void rejectedDispatchIsCounted() {
        NotificationDispatcher dispatcher = new NotificationDispatcher(sink, command -> {
            throw new RejectedExecutionException("shut down");
        }, metrics);

        assertThatCode(() -> dispatcher.dispatch(alert)).doesNotThrowAnyException();

        verify(metrics).recordDispatchFailure();
        verify(sink, never()).show(any());
    }

    @Test
    void nullIsIgnored() {
        NotificationDispatcher dispatcher = new NotificationDispatcher(sink, Runnable::run, metrics);

        dispatcher.dispatch(null);

        verify(sink, never()).show(any());
        assertThat(dispatcher.lastNotification()).isEmpty();
    }
}
