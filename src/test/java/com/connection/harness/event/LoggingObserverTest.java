package com.connection.harness.event;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.connection.harness.core.model.ConnectionKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class LoggingObserverTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingObserver.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    @Test
    @DisplayName("Should log lifecycle events at INFO")
    void testInfo() {
        new LoggingObserver().onConnectionEvent(ConnectionEvent.created(ConnectionKey.of("svc", "c1")));

        ILoggingEvent logged = appender.list.get(0);
        assertEquals(Level.INFO, logged.getLevel());
        assertTrue(logged.getFormattedMessage().contains("type=CREATED serviceType=svc connectionId=c1"));
    }

    @Test
    @DisplayName("Should log error events at WARN with their details")
    void testWarn() {
        new LoggingObserver().onConnectionEvent(ConnectionEvent.error(ConnectionKey.of("svc", "c1"), "reset"));

        ILoggingEvent logged = appender.list.get(0);
        assertEquals(Level.WARN, logged.getLevel());
        assertTrue(logged.getFormattedMessage().contains("message=reset"));
    }
}
