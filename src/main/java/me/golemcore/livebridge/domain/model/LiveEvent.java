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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Optional;

/**
 * Application-level event decoded from one JSON document of a SEND_EVENT
 * packet, e.g. {@code LIVE_OPEN_PLATFORM_DM} or
 * {@code LIVE_OPEN_PLATFORM_SEND_GIFT}.
 *
 * <p>
 * Path accessors walk nested objects, so {@code text("user_info", "uname")}
 * reads {@code data.user_info.uname}. They return empty when a segment is
 * missing or the leaf has another type.
 */
public record LiveEvent(String cmd, JsonNode data) {

    public static final String CMD_DANMAKU = "LIVE_OPEN_PLATFORM_DM";
    public static final String CMD_GIFT = "LIVE_OPEN_PLATFORM_SEND_GIFT";

    public LiveEvent {
        data = data != null ? data : NullNode.getInstance();
    }

    public Optional<String> text(String... path) {
        return resolve(path).filter(JsonNode::isTextual).map(JsonNode::asText);
    }

    public Optional<Long> number(String... path) {
        return resolve(path).filter(JsonNode::isIntegralNumber).map(JsonNode::asLong);
    }

    private Optional<JsonNode> resolve(String... path) {
        JsonNode current = data;
        for (String key : path) {
            current = current.get(key);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }
}
