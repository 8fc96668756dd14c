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
package me.golemcore.livebridge.domain.model;

import java.util.List;

/**
 * Result of a successful open platform {@code start} call.
 *
 * @param sessionId
 *            server-issued session id ({@code game_id}), used for heartbeat
 *            and end
 * @param socketUrls
 *            candidate push socket URLs, in server preference order
 * @param authBody
 *            opaque payload to send in the AUTH packet
 * @param anchor
 *            anchor (streamer) details of the paired room
 */
public record StartedSession(String sessionId, List<String> socketUrls, String authBody, Anchor anchor) {

    public StartedSession {
        socketUrls = socketUrls != null ? List.copyOf(socketUrls) : List.of();
        anchor = anchor != null ? anchor : new Anchor(null, null, null);
    }

    public record Anchor(Long roomId, String name, String openId) {
    }
}
