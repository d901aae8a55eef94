package com.facilityhub.realtime.service.notification;

import com.facilityhub.realtime.model.domain.NotificationDescriptor;

/**
 * Renders an alert to the user, e.g. as a toast in the dashboard.
 */
public interface NotificationSink {

    void show(NotificationDescriptor notification);
}
