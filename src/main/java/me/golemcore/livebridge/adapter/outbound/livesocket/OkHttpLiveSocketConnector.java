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

package me.golemcore.livebridge.adapter.outbound.livesocket;

import me.golemcore.livebridge.domain.exception.LiveConnectException;
import me.golemcore.livebridge.infrastructure.config.BotProperties;
import me.golemcore.livebridge.port.outbound.LiveSocketPort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Push socket adapter backed by OkHttp's WebSocket client.
 *
 * <p>
 * OkHttp answers server pings itself, so the listener only sees data frames,
 * the close handshake and failures. Reads never time out: the session's own
 * heartbeats keep the connection alive.
 */
@Component
@Slf4j
public class OkHttpLiveSocketConnector implements LiveSocketPort {

    private final OkHttpClient httpClient;
    private final int connectTimeoutSeconds;

    public OkHttpLiveSocketConnector(OkHttpClient baseHttpClient, BotProperties properties) {
        this.connectTimeoutSeconds = properties.getLive().getConnectTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public LiveSocket connect(String url, Listener listener) {
        CompletableFuture<Void> opened = new CompletableFuture<>();
        Request request = new Request.Builder().url(url).build();
        WebSocket webSocket = httpClient.newWebSocket(request, new ForwardingListener(listener, opened));

        try {
            opened.get(connectTimeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            webSocket.cancel();
            throw new LiveConnectException("Interrupted while connecting to " + url, e);
        } catch (ExecutionException e) {
            throw new LiveConnectException("Failed to connect to " + url + ": " + e.getCause().getMessage(),
                    e.getCause());
        } catch (TimeoutException e) {
            webSocket.cancel();
            throw new LiveConnectException("Timed out connecting to " + url + " after " + connectTimeoutSeconds + "s",
                    e);
        }

        log.info("[LiveSocket] Connected to {}", url);
        return new OkHttpLiveSocket(webSocket);
    }

    private record OkHttpLiveSocket(WebSocket webSocket) implements LiveSocket {

        @Override
        public boolean send(byte[] data) {
            return webSocket.send(ByteString.of(data));
        }

        @Override
        public void close(int code, String reason) {
            webSocket.close(code, reason);
        }

        @Override
        public void cancel() {
            webSocket.cancel();
        }
    }

    /**
     * Completes the handshake future and forwards traffic once open. Failures
     * before the handshake only fail the future. The peer's close frame is
     * reported once, from {@code onClosing}.
     */
    private static final class ForwardingListener extends WebSocketListener {

        private final Listener listener;
        private final CompletableFuture<Void> opened;

        ForwardingListener(Listener listener, CompletableFuture<Void> opened) {
            this.listener = listener;
            this.opened = opened;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            opened.complete(null);
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            listener.onBinary(bytes.toByteArray());
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            listener.onText(text);
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(code, null);
            listener.onClosed(code, reason);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            log.debug("[LiveSocket] Closed: {} {}", code, reason);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            if (opened.completeExceptionally(t)) {
                return;
            }
            listener.onFailure(t);
        }
    }
}
