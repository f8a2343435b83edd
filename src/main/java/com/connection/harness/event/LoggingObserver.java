package com.connection.harness.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every connection event to the log. Errors are logged at WARN, everything else at INFO.
 */
public class LoggingObserver implements ConnectionObserver {
    private static final Logger log = LoggerFactory.getLogger(LoggingObserver.class);

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        if (event.eventType() == ConnectionEventType.ERROR) {
            log.warn("connection.event type={} serviceType={} connectionId={} at={} details={}",
                    event.eventType(), event.serviceType(), event.connectionId(),
                    event.timestamp(), event.details());
            return;
        }
        if (event.details().isEmpty()) {
            log.info("connection.event type={} serviceType={} connectionId={} at={}",
                    event.eventType(), event.serviceType(), event.connectionId(), event.timestamp());
        } else {
            log.info("connection.event type={} serviceType={} connectionId={} at={} details={}",
                    event.eventType(), event.serviceType(), event.connectionId(),
                    event.timestamp(), event.details());
        }
    }
}
