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

package me.golemcore.livebridge.port.outbound;

import me.golemcore.livebridge.domain.model.StartedSession;

/**
 * Port for the open platform session lifecycle REST API. Every call is signed
 * with the configured access key.
 */
public interface OpenPlatformPort {

    /**
     * Open a server-side session for the room paired with the identity code.
     *
     * @param identityCode
     *            one-time pairing code of the anchor
     * @return session id, push socket URLs, auth payload and anchor details
     * @throws me.golemcore.livebridge.domain.exception.LiveApiException
     *             if the platform rejects the call or cannot be reached
     */
    StartedSession start(String identityCode);

    /**
     * Keep the server-side session alive. Best effort: a rejected heartbeat is
     * logged and does not throw.
     *
     * @throws me.golemcore.livebridge.domain.exception.LiveApiException
     *             if the platform cannot be reached
     */
    void heartbeat(String sessionId);

    /**
     * Close the server-side session. Best effort, same contract as
     * {@link #heartbeat(String)}.
     */
    void end(String sessionId);
}
