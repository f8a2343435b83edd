package com.connection.harness.event;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts connection events per connection id and records them as Micrometer counters.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code harness.connection.events}: Counter (tags: serviceType, eventType)</li>
 * </ul>
 */
public class MetricsObserver implements ConnectionObserver {

    static final String EVENTS_METER = "harness.connection.events";

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Map<ConnectionEventType, AtomicLong>> countsByConnection = new ConcurrentHashMap<>();

    public MetricsObserver() {
        this(new SimpleMeterRegistry());
    }

    public MetricsObserver(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        String key = event.serviceType() + ":" + event.eventType().name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder(EVENTS_METER)
                        .description("Number of connection lifecycle events")
                        .tag("serviceType", event.serviceType())
                        .tag("eventType", event.eventType().name())
                        .register(registry));
        counter.increment();

        countsByConnection
                .computeIfAbsent(event.connectionId(), id -> new ConcurrentHashMap<>())
                .computeIfAbsent(event.eventType(), t -> new AtomicLong())
                .incrementAndGet();
    }

    /**
     * Returns a snapshot of event counts keyed by connection id, then event type.
     */
    public Map<String, Map<ConnectionEventType, Long>> getMetrics() {
        Map<String, Map<ConnectionEventType, Long>> snapshot = new LinkedHashMap<>();
        countsByConnection.forEach((connectionId, counts) -> {
            Map<ConnectionEventType, Long> copy = new EnumMap<>(ConnectionEventType.class);
            counts.forEach((type, count) -> copy.put(type, count.get()));
            snapshot.put(connectionId, Collections.unmodifiableMap(copy));
        });
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Returns how many events of the given type were seen for a connection id.
     */
    public long count(String connectionId, ConnectionEventType type) {
        Map<ConnectionEventType, AtomicLong> counts = countsByConnection.get(connectionId);
        if (counts == null) {
            return 0;
        }
        AtomicLong count = counts.get(type);
        return count != null ? count.get() : 0;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
