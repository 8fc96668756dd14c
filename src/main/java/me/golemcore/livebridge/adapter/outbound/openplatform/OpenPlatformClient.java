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

package me.golemcore.livebridge.adapter.outbound.openplatform;

import me.golemcore.livebridge.domain.exception.LiveApiException;
import me.golemcore.livebridge.domain.exception.LiveConfigException;
import me.golemcore.livebridge.domain.model.StartedSession;
import me.golemcore.livebridge.infrastructure.config.BotProperties;
import me.golemcore.livebridge.infrastructure.http.FeignClientFactory;
import me.golemcore.livebridge.port.outbound.OpenPlatformPort;
import com.fasterxml.jackson.databind.JsonNode;
import feign.FeignException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Open platform adapter: signed JSON calls for the session lifecycle.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /v2/app/start - open a session for an identity code
 * <li>POST /v2/app/heartbeat - keep the session alive
 * <li>POST /v2/app/end - close the session
 * </ul>
 *
 * <p>
 * Responses share the envelope {@code {code, message, data}}. A non-zero code
 * fails {@link #start(String)}; for heartbeat and end it is only logged. No call
 * is retried.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code bot.live.access-key} / {@code bot.live.access-secret} - signing
 * key pair
 * <li>{@code bot.live.app-id} - project id sent with start and end
 * <li>{@code bot.live.host} - API base URL override
 * </ul>
 *
 * @see OpenPlatformSigner
 */
@Component
@Slf4j
public class OpenPlatformClient implements OpenPlatformPort {

    private final BotProperties.LiveProperties properties;
    private final OpenPlatformApi api;

    @Autowired
    public OpenPlatformClient(BotProperties properties, FeignClientFactory feignClientFactory, Clock clock) {
        this(properties, feignClientFactory, new OpenPlatformSigner(
                properties.getLive().getAccessKey(), properties.getLive().getAccessSecret(), clock));
    }

    OpenPlatformClient(BotProperties properties, FeignClientFactory feignClientFactory, OpenPlatformSigner signer) {
        this.properties = properties.getLive();
        this.api = feignClientFactory.create(OpenPlatformApi.class, this.properties.resolveHost(), signer);
    }

    @Override
    public StartedSession start(String identityCode) {
        long appId = requireAppId();
        OpenPlatformApi.ApiEnvelope<OpenPlatformApi.StartData> response = call("start",
                () -> api.start(new OpenPlatformApi.StartRequest(identityCode, appId)));

        if (response.code() != 0) {
            throw new LiveApiException(response.code(),
                    "Open platform start rejected: " + response.code() + " " + response.message());
        }

        OpenPlatformApi.StartData data = response.data();
        if (data == null || data.gameInfo() == null || data.gameInfo().gameId() == null
                || data.websocketInfo() == null) {
            throw new LiveApiException(response.code(), "Open platform start returned no session data");
        }

        OpenPlatformApi.AnchorInfo anchor = data.anchorInfo();
        StartedSession session = new StartedSession(
                data.gameInfo().gameId(),
                data.websocketInfo().wssLink(),
                data.websocketInfo().authBody(),
                anchor != null
                        ? new StartedSession.Anchor(anchor.roomId(), anchor.uname(), anchor.openId())
                        : null);
        log.info("[OpenPlatform] Session {} started, {} socket endpoint(s)",
                session.sessionId(), session.socketUrls().size());
        return session;
    }

    @Override
    public void heartbeat(String sessionId) {
        OpenPlatformApi.ApiEnvelope<JsonNode> response = call("heartbeat",
                () -> api.heartbeat(new OpenPlatformApi.HeartbeatRequest(sessionId)));
        if (response.code() != 0) {
            log.warn("[OpenPlatform] Heartbeat for {} rejected: {} {}", sessionId, response.code(),
                    response.message());
            return;
        }
        log.debug("[OpenPlatform] Heartbeat for {} acknowledged", sessionId);
    }

    @Override
    public void end(String sessionId) {
        long appId = requireAppId();
        OpenPlatformApi.ApiEnvelope<JsonNode> response = call("end",
                () -> api.end(new OpenPlatformApi.EndRequest(appId, sessionId)));
        if (response.code() != 0) {
            log.warn("[OpenPlatform] End for {} rejected: {} {}", sessionId, response.code(), response.message());
            return;
        }
        log.info("[OpenPlatform] Session {} ended", sessionId);
    }

    private long requireAppId() {
        Long appId = properties.getAppId();
        if (appId == null) {
            throw new LiveConfigException("bot.live.app-id is not configured");
        }
        return appId;
    }

    private <T> OpenPlatformApi.ApiEnvelope<T> call(String label, ApiCall<T> call) {
        OpenPlatformApi.ApiEnvelope<T> response;
        try {
            response = call.execute();
        } catch (FeignException e) {
            throw new LiveApiException("Open platform " + label + " call failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new LiveApiException(LiveApiException.NO_CODE, "Open platform " + label + " returned an empty body");
        }
        return response;
    }

    @FunctionalInterface
    private interface ApiCall<T> {
        OpenPlatformApi.ApiEnvelope<T> execute();
    }
}
