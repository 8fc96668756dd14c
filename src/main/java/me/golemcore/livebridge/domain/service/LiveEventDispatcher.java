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
import me.golemcore.livebridge.domain.model.LiveEvent;
import me.golemcore.livebridge.protocol.Packet;
import me.golemcore.livebridge.protocol.PacketOperation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns decoded packets into {@link LiveEvent}s and fans them out.
 *
 * <p>
 * A SEND_EVENT body holds JSON documents separated by zero bytes. Each document
 * is parsed on its own; a malformed one, including a document followed by
 * trailing content, is logged and skipped without affecting its siblings. Every parsed event is published on the
 * {@link LiveEventBroadcaster} as {@code live.event} and then offered to the
 * {@link LiveEventQueue}; a rejected offer does not stop publication.
 *
 * <p>
 * AUTH_REPLY and HEARTBEAT_REPLY are only logged, other operations are
 * ignored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LiveEventDispatcher {

    private static final int PREVIEW_CHARS = 200;

    private final ObjectMapper objectMapper;
    private final LiveEventBroadcaster broadcaster;
    private final LiveEventQueue eventQueue;

    public void dispatch(Packet packet) {
        if (packet.is(PacketOperation.SEND_EVENT)) {
            log.debug("[Live] Event packet: {}", packet);
            for (LiveEvent event : parseEvents(packet.body())) {
                publish(event);
            }
        } else if (packet.is(PacketOperation.AUTH_REPLY)) {
            log.info("[Live] Auth reply received: {}", preview(packet.body()));
        } else if (packet.is(PacketOperation.HEARTBEAT_REPLY)) {
            log.debug("[Live] Heartbeat reply: {}", packet);
        } else {
            log.debug("[Live] Ignoring packet: {}", packet);
        }
    }

    /**
     * Split a SEND_EVENT body on zero bytes and parse each non-empty chunk.
     */
    public List<LiveEvent> parseEvents(byte[] body) {
        List<LiveEvent> events = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= body.length; i++) {
            if (i < body.length && body[i] != 0) {
                continue;
            }
            if (i > start) {
                LiveEvent event = parseDocument(Arrays.copyOfRange(body, start, i));
                if (event != null) {
                    events.add(event);
                }
            }
            start = i + 1;
        }
        return events;
    }

    private LiveEvent parseDocument(byte[] chunk) {
        try {
            JsonNode node = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(chunk);
            JsonNode cmd = node != null ? node.get("cmd") : null;
            if (cmd == null || !cmd.isTextual()) {
                log.warn("[Live] Skipping event without cmd: {}", preview(chunk));
                return null;
            }
            return new LiveEvent(cmd.asText(), node.get("data"));
        } catch (JsonProcessingException e) {
            log.warn("[Live] Skipping malformed event JSON ({}): {}", e.getOriginalMessage(), preview(chunk));
            return null;
        } catch (IOException e) {
            log.warn("[Live] Failed to read event JSON: {}", e.getMessage());
            return null;
        }
    }

    private void publish(LiveEvent event) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("cmd", event.cmd());
        payload.set("data", event.data());
        broadcaster.publish(LiveEnvelope.LIVE_EVENT, payload);

        if (!eventQueue.offer(event)) {
            log.warn("[Live] Event queue {}, {} not handed to auto-response",
                    eventQueue.isClosed() ? "closed" : "full", event.cmd());
        }
    }

    private static String preview(byte[] bytes) {
        String text = new String(bytes, StandardCharsets.UTF_8);
        return text.length() > PREVIEW_CHARS ? text.substring(0, PREVIEW_CHARS) + "..." : text;
    }
}
