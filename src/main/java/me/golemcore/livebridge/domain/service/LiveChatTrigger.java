/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.livebridge.domain.service;

import me.golemcore.livebridge.domain.model.LiveChatMessageEvent;
import me.golemcore.livebridge.domain.model.LiveEvent;
import me.golemcore.livebridge.infrastructure.config.BotProperties;
import me.golemcore.livebridge.infrastructure.event.SpringEventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Drains the live event queue and turns viewer chat messages into
 * {@link LiveChatMessageEvent}s for whatever answers them.
 */
@Component
@Slf4j
public class LiveChatTrigger {

    static final String ANONYMOUS = "anonymous";
    private static final long POLL_TIMEOUT_MS = 500;

    private final LiveEventQueue queue;
    private final SpringEventBus eventBus;
    private final BotProperties properties;

    private volatile boolean running;
    private Thread worker;

    public LiveChatTrigger(LiveEventQueue queue, SpringEventBus eventBus, BotProperties properties) {
        this.queue = queue;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        if (!properties.getLive().isChatTriggerEnabled()) {
            log.info("[Live] Chat trigger disabled");
            return;
        }
        running = true;
        worker = new Thread(this::drain, "live-chat-trigger");
        worker.setDaemon(true);
        worker.start();
    }

    @PreDestroy
    public void stop() {
        running = false;
        queue.close();
        Thread thread = worker;
        if (thread != null) {
            thread.interrupt();
        }
    }

    /**
     * Map one queued event to a chat message, if it is one.
     */
    public Optional<LiveChatMessageEvent> toChatMessage(LiveEvent event) {
        if (!LiveEvent.CMD_DANMAKU.equals(event.cmd())) {
            return Optional.empty();
        }
        Optional<String> message = event.text("msg").map(String::trim).filter(msg -> !msg.isEmpty());
        if (message.isEmpty()) {
            return Optional.empty();
        }
        String sender = event.text("uname").filter(name -> !name.isBlank()).orElse(ANONYMOUS);
        Long roomId = event.number("room_id").orElse(null);
        return Optional.of(new LiveChatMessageEvent(sender, message.get(), roomId));
    }

    private void drain() {
        while (running) {
            LiveEvent event;
            try {
                event = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event == null) {
                continue;
            }
            toChatMessage(event).ifPresent(chat -> {
                log.debug("[Live] Chat from {}: {}", chat.sender(), chat.message());
                eventBus.publish(chat);
            });
        }
        log.debug("[Live] Chat trigger stopped");
    }
}
