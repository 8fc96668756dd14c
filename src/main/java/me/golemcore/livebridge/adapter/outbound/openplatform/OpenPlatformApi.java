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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import feign.Headers;
import feign.RequestLine;

import java.util.List;

/**
 * Feign contract of the open platform session lifecycle endpoints.
 */
@Headers({ "Content-Type: application/json", "Accept: application/json" })
interface OpenPlatformApi {

    @RequestLine("POST /v2/app/start")
    ApiEnvelope<StartData> start(StartRequest request);

    @RequestLine("POST /v2/app/heartbeat")
    ApiEnvelope<JsonNode> heartbeat(HeartbeatRequest request);

    @RequestLine("POST /v2/app/end")
    ApiEnvelope<JsonNode> end(EndRequest request);

    // Request DTOs
    record StartRequest(String code, @JsonProperty("app_id") long appId) {
    }

    record HeartbeatRequest(@JsonProperty("game_id") String gameId) {
    }

    record EndRequest(@JsonProperty("app_id") long appId, @JsonProperty("game_id") String gameId) {
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ApiEnvelope<T>(int code, String message, T data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StartData(
            @JsonProperty("game_info") GameInfo gameInfo,
            @JsonProperty("websocket_info") WebsocketInfo websocketInfo,
            @JsonProperty("anchor_info") AnchorInfo anchorInfo) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GameInfo(@JsonProperty("game_id") String gameId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record WebsocketInfo(
            @JsonProperty("auth_body") String authBody,
            @JsonProperty("wss_link") List<String> wssLink) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AnchorInfo(
            @JsonProperty("room_id") Long roomId,
            @JsonProperty("uname") String uname,
            @JsonProperty("open_id") String openId) {
    }
}
