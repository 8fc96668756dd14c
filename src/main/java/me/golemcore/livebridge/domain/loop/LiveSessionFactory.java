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

package me.golemcore.livebridge.domain.loop;

import me.golemcore.livebridge.domain.exception.LiveConnectException;
import me.golemcore.livebridge.domain.model.LiveSessionInfo;
import me.golemcore.livebridge.domain.model.StartedSession;
import me.golemcore.livebridge.domain.service.LiveEventDispatcher;
import me.golemcore.livebridge.infrastructure.config.BotProperties;
import me.golemcore.livebridge.port.outbound.LiveSocketPort;
import me.golemcore.livebridge.port.outbound.OpenPlatformPort;
import me.golemcore.livebridge.protocol.PacketCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Opens {@link LiveSession}s: connects and authenticates synchronously, then
 * hands the session over to its own loop thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LiveSessionFactory {

    private final OpenPlatformPort openPlatform;
    private final LiveSocketPort socketPort;
    private final PacketCodec codec;
    private final LiveEventDispatcher dispatcher;
    private final BotProperties properties;

    /**
     * Connect to {@code socketUrl} and start listening.
     *
     * @throws LiveConnectException
     *             if the socket cannot be opened or the AUTH packet cannot be
     *             sent; the server-side session has already been ended best
     *             effort
     */
    public LiveSession open(StartedSession started, String socketUrl, LiveSessionInfo info) {
        BotProperties.LiveProperties live = properties.getLive();
        LiveSession session = new LiveSession(info, started.authBody(), openPlatform, codec, dispatcher,
                Duration.ofSeconds(Math.max(1, live.getPacketHeartbeatIntervalSeconds())),
                Duration.ofSeconds(live.resolveHeartbeatIntervalSeconds()));
        try {
            session.connect(socketPort, socketUrl);
        } catch (RuntimeException e) {
            log.warn("[Live] Connect failed for session {}: {}", info.sessionId(), e.getMessage());
            endQuietly(info.sessionId());
            if (e instanceof LiveConnectException connectException) {
                throw connectException;
            }
            throw new LiveConnectException("Failed to connect to " + socketUrl, e);
        }
        session.startLoop();
        return session;
    }

    private void endQuietly(String sessionId) {
        try {
            openPlatform.end(sessionId);
        } catch (RuntimeException e) {
            log.warn("[Live] End call after connect failure failed: {}", e.getMessage());
        }
    }
}
