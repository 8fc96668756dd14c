package me.golemcore.livebridge.domain.service;

import me.golemcore.livebridge.domain.model.LiveEvent;
import me.golemcore.livebridge.infrastructure.config.BotProperties;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiveEventQueueTest {

    @Test
    void shouldUseConfiguredCapacity() {
        BotProperties properties = new BotProperties();
        properties.getLive().setEventQueueCapacity(2);
        LiveEventQueue queue = new LiveEventQueue(properties);

        assertTrue(queue.offer(new LiveEvent("A", null)));
        assertTrue(queue.offer(new LiveEvent("B", null)));
        assertFalse(queue.offer(new LiveEvent("C", null)));
        assertEquals(2, queue.size());
    }

    @Test
    void shouldReturnEventsInOfferOrder() throws Exception {
        LiveEventQueue queue = new LiveEventQueue(4);
        queue.offer(new LiveEvent("A", null));
        queue.offer(new LiveEvent("B", null));

        assertEquals("A", queue.poll(10, TimeUnit.MILLISECONDS).cmd());
        assertEquals("B", queue.poll(10, TimeUnit.MILLISECONDS).cmd());
        assertNull(queue.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldRejectOffersAfterClose() {
        LiveEventQueue queue = new LiveEventQueue(4);

        queue.close();

        assertTrue(queue.isClosed());
        assertFalse(queue.offer(new LiveEvent("A", null)));
    }
}
