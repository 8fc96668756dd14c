package me.golemcore.livebridge.domain.service;

import me.golemcore.livebridge.domain.model.LiveChatMessageEvent;
import me.golemcore.livebridge.domain.model.LiveEvent;
import me.golemcore.livebridge.infrastructure.config.BotProperties;
import me.golemcore.livebridge.infrastructure.event.SpringEventBus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class LiveChatTriggerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private LiveEventQueue queue;
    private SpringEventBus eventBus;
    private BotProperties properties;
    private LiveChatTrigger trigger;

    @BeforeEach
    void setUp() {
        queue = new LiveEventQueue(16);
        eventBus = mock(SpringEventBus.class);
        properties = new BotProperties();
        trigger = new LiveChatTrigger(queue, eventBus, properties);
    }

    @AfterEach
    void tearDown() {
        trigger.stop();
    }

    @Test
    void shouldMapDanmakuToChatMessage() throws Exception {
        LiveEvent event = event(LiveEvent.CMD_DANMAKU, "{\"msg\":\" hello \",\"uname\":\"viewer\",\"room_id\":4242}");

        Optional<LiveChatMessageEvent> chat = trigger.toChatMessage(event);

        assertTrue(chat.isPresent());
        assertEquals("viewer", chat.get().sender());
        assertEquals("hello", chat.get().message());
        assertEquals(4242L, chat.get().roomId());
    }

    @Test
    void shouldDefaultSenderToAnonymous() throws Exception {
        LiveChatMessageEvent chat = trigger.toChatMessage(event(LiveEvent.CMD_DANMAKU, "{\"msg\":\"hi\"}"))
                .orElseThrow();

        assertEquals(LiveChatTrigger.ANONYMOUS, chat.sender());
        assertNull(chat.roomId());
    }

    @Test
    void shouldIgnoreBlankMessagesAndOtherCommands() throws Exception {
        assertFalse(trigger.toChatMessage(event(LiveEvent.CMD_DANMAKU, "{\"msg\":\"   \"}")).isPresent());
        assertFalse(trigger.toChatMessage(event(LiveEvent.CMD_DANMAKU, "{}")).isPresent());
        assertFalse(trigger.toChatMessage(event(LiveEvent.CMD_GIFT, "{\"msg\":\"hi\"}")).isPresent());
    }

    @Test
    void shouldPublishQueuedChatMessages() throws Exception {
        trigger.start();

        queue.offer(event(LiveEvent.CMD_GIFT, "{\"gift_name\":\"rocket\"}"));
        queue.offer(event(LiveEvent.CMD_DANMAKU, "{\"msg\":\"hello\",\"uname\":\"viewer\"}"));

        verify(eventBus, timeout(2000)).publish(new LiveChatMessageEvent("viewer", "hello", null));
    }

    @Test
    void shouldNotDrainWhenDisabled() throws Exception {
        properties.getLive().setChatTriggerEnabled(false);
        trigger.start();

        queue.offer(event(LiveEvent.CMD_DANMAKU, "{\"msg\":\"hello\"}"));

        verify(eventBus, after(200).never()).publish(any());
        assertEquals(1, queue.size());
    }

    @Test
    void stopShouldCloseQueue() {
        trigger.start();

        trigger.stop();

        assertTrue(queue.isClosed());
        assertFalse(queue.offer(new LiveEvent(LiveEvent.CMD_DANMAKU, null)));
    }

    private LiveEvent event(String cmd, String data) throws Exception {
        JsonNode node = objectMapper.readTree(data);
        return new LiveEvent(cmd, node);
    }
}
