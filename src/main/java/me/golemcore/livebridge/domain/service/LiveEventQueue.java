package me.golemcore.livebridge.domain.service;

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

import me.golemcore.livebridge.domain.model.LiveEvent;
import me.golemcore.livebridge.infrastructure.config.BotProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off queue from the live core to the auto-response consumer.
 *
 * <p>
 * Producers never block: {@link #offer(LiveEvent)} reports a full or closed
 * queue by returning {@code false}.
 */
@Component
public class LiveEventQueue {

    private final BlockingQueue<LiveEvent> queue;
    private volatile boolean closed;

    @Autowired
    public LiveEventQueue(BotProperties properties) {
        this(properties.getLive().getEventQueueCapacity());
    }

    LiveEventQueue(int capacity) {
        this.queue = new LinkedBlockingQueue<>(Math.max(1, capacity));
    }

    public boolean offer(LiveEvent event) {
        if (closed) {
            return false;
        }
        return queue.offer(event);
    }

    /**
     * Wait up to {@code timeout} for the next event.
     *
     * @return the event, or {@code null} if none arrived in time
     */
    public LiveEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return queue.size();
    }
}
