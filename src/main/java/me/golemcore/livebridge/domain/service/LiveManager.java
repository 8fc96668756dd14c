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

import me.golemcore.livebridge.domain.exception.LiveApiException;
import me.golemcore.livebridge.domain.exception.LiveConfigException;
import me.golemcore.livebridge.domain.exception.LiveSessionActiveException;
import me.golemcore.livebridge.domain.loop.LiveSession;
import me.golemcore.livebridge.domain.loop.LiveSessionFactory;
import me.golemcore.livebridge.domain.model.LiveEnvelope;
import me.golemcore.livebridge.domain.model.LiveSessionInfo;
import me.golemcore.livebridge.domain.model.LiveSessionState;
import me.golemcore.livebridge.domain.model.LiveSessionTerminatedEvent;
import me.golemcore.livebridge.domain.model.StartedSession;
import me.golemcore.livebridge.infrastructure.config.BotProperties;
import me.golemcore.livebridge.infrastructure.event.SpringEventBus;
import me.golemcore.livebridge.port.outbound.OpenPlatformPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns at most one live session at a time.
 *
 * <p>
 * {@link #start()} runs the REST start call and the socket handshake on the
 * caller's thread and only returns once the session is listening.
 * {@link #stop()} asks the session to shut down and waits for it, so the
 * server-side session has been ended by the time it returns.
 *
 * <p>
 * A session that ends on its own (server close, socket failure) drops back to
 * idle and is reported as a {@link LiveSessionTerminatedEvent}.
 *
 * <p>
 * Callers serialise start and stop; concurrent calls are not coordinated.
 */
@Service
@Slf4j
public class LiveManager {

    static final long STOP_TIMEOUT_SECONDS = 30;
    static final String UNKNOWN_ANCHOR = "Unknown";

    private final OpenPlatformPort openPlatform;
    private final LiveSessionFactory sessionFactory;
    private final LiveEventBroadcaster broadcaster;
    private final SpringEventBus eventBus;
    private final BotProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicReference<LiveSession> active = new AtomicReference<>();

    public LiveManager(OpenPlatformPort openPlatform, LiveSessionFactory sessionFactory,
            LiveEventBroadcaster broadcaster, SpringEventBus eventBus, BotProperties properties,
            ObjectMapper objectMapper, Clock clock) {
        this.openPlatform = openPlatform;
        this.sessionFactory = sessionFactory;
        this.broadcaster = broadcaster;
        this.eventBus = eventBus;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Start a session for the configured identity code.
     *
     * @throws LiveSessionActiveException
     *             if a session is already running; it is left untouched
     * @throws LiveConfigException
     *             if credentials or the identity code are missing
     * @throws LiveApiException
     *             if the start call fails or returns no socket URL
     * @throws me.golemcore.livebridge.domain.exception.LiveConnectException
     *             if the push socket cannot be opened
     */
    public LiveSessionInfo start() {
        LiveSession current = active.get();
        if (current != null) {
            throw new LiveSessionActiveException("Live session " + current.info().sessionId() + " is already active");
        }

        BotProperties.LiveProperties live = properties.getLive();
        if (!live.hasCredentials()) {
            throw new LiveConfigException("Open platform credentials are not configured (access key, secret, app id)");
        }
        String identityCode = live.getIdentityCode();
        if (identityCode == null || identityCode.isBlank()) {
            throw new LiveConfigException("Anchor identity code is not configured");
        }

        StartedSession started = openPlatform.start(identityCode.trim());
        if (started.socketUrls().isEmpty()) {
            endQuietly(started.sessionId());
            throw new LiveApiException(LiveApiException.NO_CODE,
                    "Start response for session " + started.sessionId() + " has no socket URL");
        }

        LiveSessionInfo info = LiveSessionInfo.builder()
                .sessionId(started.sessionId())
                .roomId(started.anchor().roomId() != null ? started.anchor().roomId() : 0L)
                .anchorName(started.anchor().name() != null ? started.anchor().name() : UNKNOWN_ANCHOR)
                .anchorOpenId(started.anchor().openId())
                .startedAt(OffsetDateTime.now(clock.withZone(zone())))
                .build();

        LiveSession session = sessionFactory.open(started, started.socketUrls().get(0), info);
        active.set(session);
        session.termination().whenComplete((state, error) -> onTerminated(session, state, error));

        log.info("[Live] Session {} started for room {} ({})", info.sessionId(), info.roomId(), info.anchorName());
        broadcaster.publish(LiveEnvelope.LIVE_STARTED, sessionPayload(info));
        return info;
    }

    /**
     * Stop the active session, if any, and wait for it to unwind.
     *
     * @return the stopped session, or empty when nothing was running
     */
    public Optional<LiveSessionInfo> stop() {
        LiveSession session = active.getAndSet(null);
        if (session == null) {
            ObjectNode idle = objectMapper.createObjectNode();
            idle.put("active", false);
            broadcaster.publish(LiveEnvelope.LIVE_STOPPED, idle);
            return Optional.empty();
        }

        session.cancel();
        awaitTermination(session);

        LiveSessionInfo info = session.info();
        ObjectNode payload = sessionPayload(info);
        payload.put("active", false);
        broadcaster.publish(LiveEnvelope.LIVE_STOPPED, payload);
        log.info("[Live] Session {} stopped", info.sessionId());
        return Optional.of(info);
    }

    public Optional<LiveSessionInfo> status() {
        return Optional.ofNullable(active.get()).map(LiveSession::info);
    }

    /**
     * Session details in the shape the status surfaces report.
     */
    public ObjectNode sessionPayload(LiveSessionInfo info) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("active", true);
        payload.put("game_id", info.sessionId());
        payload.put("room_id", info.roomId());
        payload.put("anchor_name", info.anchorName());
        payload.put("anchor_open_id", info.anchorOpenId());
        payload.put("started_at", info.startedAt().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        payload.put("uptime_seconds", info.uptimeSeconds(clock));
        return payload;
    }

    @PreDestroy
    public void shutdown() {
        LiveSession session = active.getAndSet(null);
        if (session != null) {
            log.info("[Live] Shutting down with active session {}", session.info().sessionId());
            session.abort();
        }
    }

    private void awaitTermination(LiveSession session) {
        try {
            session.termination().get(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            log.warn("[Live] Session {} ended with error: {}", session.info().sessionId(), e.getCause().getMessage());
        } catch (TimeoutException e) {
            log.warn("[Live] Session {} did not stop within {}s, aborting", session.info().sessionId(),
                    STOP_TIMEOUT_SECONDS);
            session.abort();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.abort();
        }
    }

    private void onTerminated(LiveSession session, LiveSessionState state, Throwable error) {
        if (!active.compareAndSet(session, null)) {
            return;
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        LiveSessionState finalState = state != null ? state : LiveSessionState.FAILED;
        log.info("[Live] Session {} ended by the connection ({})", session.info().sessionId(), finalState);
        ObjectNode payload = sessionPayload(session.info());
        payload.put("active", false);
        broadcaster.publish(LiveEnvelope.LIVE_STOPPED, payload);
        eventBus.publish(new LiveSessionTerminatedEvent(session.info(), finalState, cause));
    }

    private ZoneId zone() {
        String zone = properties.getLive().getZone();
        return zone != null && !zone.isBlank() ? ZoneId.of(zone) : ZoneId.systemDefault();
    }

    private void endQuietly(String sessionId) {
        try {
            openPlatform.end(sessionId);
        } catch (RuntimeException e) {
            log.warn("[Live] End call failed for session {}: {}", sessionId, e.getMessage());
        }
    }
}
