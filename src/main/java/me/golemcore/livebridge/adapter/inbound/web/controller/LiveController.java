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

package me.golemcore.livebridge.adapter.inbound.web.controller;

import me.golemcore.livebridge.adapter.inbound.web.dto.LiveStatusResponse;
import me.golemcore.livebridge.domain.model.LiveEnvelope;
import me.golemcore.livebridge.domain.model.LiveSessionInfo;
import me.golemcore.livebridge.domain.service.LiveEventBroadcaster;
import me.golemcore.livebridge.domain.service.LiveManager;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Start, stop and inspect the live session; stream bus events.
 */
@RestController
@RequestMapping("/api/live")
public class LiveController {

    private final LiveManager liveManager;
    private final LiveEventBroadcaster broadcaster;
    private final Clock clock;
    private final ReentrantLock lifecycleLock = new ReentrantLock();

    public LiveController(LiveManager liveManager, LiveEventBroadcaster broadcaster, Clock clock) {
        this.liveManager = liveManager;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    @PostMapping("/start")
    public Mono<ResponseEntity<LiveStatusResponse>> start() {
        return Mono.fromCallable(() -> locked(() -> toResponse(Optional.of(liveManager.start()))))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/stop")
    public Mono<ResponseEntity<LiveStatusResponse>> stop() {
        return Mono.fromCallable(() -> locked(() -> {
            Optional<LiveSessionInfo> stopped = liveManager.stop();
            LiveStatusResponse response = toResponse(stopped);
            response.setActive(false);
            return response;
        }))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<LiveStatusResponse>> status() {
        return Mono.just(ResponseEntity.ok(toResponse(liveManager.status())));
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> events() {
        return broadcaster.stream()
                .map(this::toServerSentEvent);
    }

    private ServerSentEvent<String> toServerSentEvent(LiveEnvelope envelope) {
        return ServerSentEvent.<String>builder()
                .event(envelope.eventName())
                .data(envelope.payload().toString())
                .build();
    }

    private LiveStatusResponse toResponse(Optional<LiveSessionInfo> info) {
        if (info.isEmpty()) {
            return LiveStatusResponse.builder().active(false).build();
        }
        LiveSessionInfo session = info.get();
        return LiveStatusResponse.builder()
                .active(true)
                .sessionId(session.sessionId())
                .roomId(session.roomId())
                .anchorName(session.anchorName())
                .anchorOpenId(session.anchorOpenId())
                .startedAt(session.startedAt().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME))
                .uptimeSeconds(session.uptimeSeconds(clock))
                .build();
    }

    private <T> T locked(Supplier<T> action) {
        lifecycleLock.lock();
        try {
            return action.get();
        } finally {
            lifecycleLock.unlock();
        }
    }
}
