package com.connection.harness.event;

/**
 * Thrown after an event has been delivered to every observer when at least one
 * observer failed. Each observer failure is attached as a suppressed exception.
 */
public class ObserverNotificationException extends RuntimeException {

    private final ConnectionEvent event;

    public ObserverNotificationException(ConnectionEvent event, int failures) {
        super(failures + " observer(s) failed to handle " + event.eventType()
                + " event for " + event.serviceType() + ":" + event.connectionId());
        this.event = event;
    }

    public ConnectionEvent getEvent() {
        return event;
    }
}
