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

import me.golemcore.livebridge.domain.model.LiveEnvelope;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Multi-consumer fan-out bus for live notifications.
 *
 * <p>
 * Every subscriber of {@link #stream()} receives each envelope published after
 * it subscribed; nothing is replayed. A slow subscriber misses items instead of
 * stalling producers. Producers other than the live session (status
 * announcements, the manager itself) may publish concurrently.
 */
@Service
@Slf4j
public class LiveEventBroadcaster {

    private final Object emitLock = new Object();
    private final Sinks.Many<LiveEnvelope> sink = Sinks.many().multicast().directBestEffort();

    public void publish(String eventName, JsonNode payload) {
        LiveEnvelope envelope = new LiveEnvelope(eventName, payload);
        Sinks.EmitResult result;
        synchronized (emitLock) {
            result = sink.tryEmitNext(envelope);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("[Live] Failed to publish {}: {}", eventName, result);
        }
    }

    public Flux<LiveEnvelope> stream() {
        return sink.asFlux();
    }

    public int subscriberCount() {
        return sink.currentSubscriberCount();
    }
}
