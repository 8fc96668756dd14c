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

import lombok.Builder;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Immutable snapshot of a live session, taken once when the session starts.
 */
@Builder
public record LiveSessionInfo(String sessionId, long roomId, String anchorName, String anchorOpenId,
        OffsetDateTime startedAt) {

    public long uptimeSeconds(Clock clock) {
        long seconds = Duration.between(startedAt.toInstant(), clock.instant()).getSeconds();
        return Math.max(0, seconds);
    }
}
