package com.connection.harness.support;

import com.connection.harness.event.ConnectionEvent;
import com.connection.harness.event.ConnectionEventType;
import com.connection.harness.event.ConnectionObserver;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Observer that keeps every event it receives. Optionally appends its name to a shared
 * list so tests can check delivery order across observers.
 */
public class RecordingObserver implements ConnectionObserver {

    private final String name;
    private final List<String> deliveryLog;
    private final List<ConnectionEvent> events = new CopyOnWriteArrayList<>();

    public RecordingObserver() {
        this("observer", null);
    }

    public RecordingObserver(String name, List<String> deliveryLog) {
        this.name = name;
        this.deliveryLog = deliveryLog;
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        events.add(event);
        if (deliveryLog != null) {
            deliveryLog.add(name);
        }
    }

    public List<ConnectionEvent> getEvents() {
        return events;
    }

    public List<ConnectionEvent> eventsOfType(ConnectionEventType type) {
        return events.stream().filter(e -> e.eventType() == type).toList();
    }

    @Override
    public String toString() {
        return "RecordingObserver{" + name + "}";
    }
}
