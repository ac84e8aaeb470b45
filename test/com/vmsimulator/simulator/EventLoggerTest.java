package com.vmsimulator.simulator;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class EventLoggerTest {

    private EventLogger logger;

    @BeforeEach
    void setUp() {
        logger = new EventLogger();
    }

    @Test
    void testLogAddsTimestampedEntry() {
        logger.log("hello");

        List<String> events = logger.getEvents();
        assertEquals(1, events.size());
        assertTrue(events.get(0).matches("\\[\\d{2}:\\d{2}:\\d{2}\\.\\d{3}\\] hello"), events.get(0));
    }

    @Test
    void testListenersAreNotified() {
        List<String> received = new ArrayList<>();
        EventLogger.EventListener listener = received::add;
        logger.addListener(listener);

        logger.log("one");
        logger.removeListener(listener);
        logger.log("two");

        assertEquals(1, received.size());
        assertTrue(received.get(0).endsWith("one"));
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        List<String> received = new ArrayList<>();
        logger.addListener(event -> {
            throw new IllegalStateException("boom");
        });
        logger.addListener(received::add);

        logger.log("event");

        assertEquals(1, received.size());
        List<String> events = logger.getEvents();
        assertEquals(2, events.size());
        assertTrue(events.get(1).contains("listener failed"));
    }

    @Test
    void testClear() {
        logger.log("a");
        logger.clear();
        assertTrue(logger.getEvents().isEmpty());
    }
}
