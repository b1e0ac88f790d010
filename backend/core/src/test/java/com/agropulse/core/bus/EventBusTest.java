package com.agropulse.core.bus;

import com.agropulse.core.events.Event;
import com.agropulse.core.events.RefreshCompleted;
import com.agropulse.core.events.RefreshStarted;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(RefreshStarted.class, event -> hitsA.incrementAndGet());
        bus.subscribe(RefreshStarted.class, event -> hitsB.incrementAndGet());

        bus.publish(new RefreshStarted(T0, "news", false));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToCorrectEventType() {
        EventBus bus = new EventBus();
        AtomicInteger startedHits = new AtomicInteger();
        AtomicInteger completedHits = new AtomicInteger();

        bus.subscribe(RefreshStarted.class, event -> startedHits.incrementAndGet());
        bus.subscribe(RefreshCompleted.class, event -> completedHits.incrementAndGet());

        bus.publish(new RefreshStarted(T0, "news", true));
        bus.publish(new RefreshCompleted(T0.plusSeconds(1), "news", true, 1000, List.of(), null));

        assertEquals(1, startedHits.get());
        assertEquals(1, completedHits.get());
    }

    @Test
    void wildcardSubscribersSeeEveryEventAfterTypedHandlers() {
        EventBus bus = new EventBus();
        List<String> order = new CopyOnWriteArrayList<>();

        bus.subscribeAll(event -> order.add("all:" + event.type()));
        bus.subscribe(RefreshStarted.class, event -> order.add("typed"));

        bus.publish(new RefreshStarted(T0, "quotes", false));
        bus.publish(new RefreshCompleted(T0, "quotes", false, 5, List.of(), "boom"));

        assertEquals(List.of("typed", "all:RefreshStarted", "all:RefreshCompleted"), order);
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        AtomicReference<Event> failedEvent = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> {
            failedEvent.set(event);
            capturedError.set(error);
        });
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(RefreshStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(RefreshStarted.class, event -> safeHits.incrementAndGet());

        bus.publish(new RefreshStarted(T0, "news", false));

        assertEquals(1, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
        assertEquals("RefreshStarted", failedEvent.get().type());
    }
}
