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
import me.golemcore.livebridge.domain.exception.LiveTransportException;
import me.golemcore.livebridge.domain.model.LiveSessionInfo;
import me.golemcore.livebridge.domain.model.LiveSessionState;
import me.golemcore.livebridge.domain.service.LiveEventDispatcher;
import me.golemcore.livebridge.port.outbound.LiveSocketPort;
import me.golemcore.livebridge.port.outbound.OpenPlatformPort;
import me.golemcore.livebridge.protocol.LiveProtocolException;
import me.golemcore.livebridge.protocol.Packet;
import me.golemcore.livebridge.protocol.PacketCodec;
import me.golemcore.livebridge.protocol.PacketOperation;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One connection to the push service, from socket handshake to the final
 * {@code end} call.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>{@code STARTING -> CONNECTED}: {@link LiveSessionFactory#open} connects
 * the socket on the caller's thread; a failure is thrown before any session
 * object escapes.
 * <li>{@code CONNECTED -> LISTENING}: the AUTH packet is sent; the reply is not
 * awaited.
 * <li>{@code LISTENING}: a dedicated thread takes signals from one queue fed by
 * the packet heartbeat timer, the REST heartbeat timer, the socket listener and
 * {@link #cancel()}. Signals are handled in arrival order.
 * <li>{@code SHUTTING_DOWN -> CLOSED}: timers stop, {@code end} is called once,
 * the socket is closed and {@link #termination()} completes. A socket failure
 * ends in {@code FAILED} and completes the future exceptionally with
 * {@link LiveTransportException}.
 * </ol>
 *
 * <p>
 * Malformed packets and failed heartbeats are logged and never change state.
 * There is no reconnection.
 *
 * <p>
 * {@link #abort()} is the hard teardown path: it drops the socket and
 * interrupts the loop without calling {@code end}; the server-side session is
 * left to expire on its own.
 */
@Slf4j
public class LiveSession {

    static final int NORMAL_CLOSURE = 1000;

    private final LiveSessionInfo info;
    private final String authBody;
    private final OpenPlatformPort openPlatform;
    private final PacketCodec codec;
    private final LiveEventDispatcher dispatcher;
    private final Duration packetHeartbeatInterval;
    private final Duration apiHeartbeatInterval;

    private final BlockingQueue<SessionSignal> signals = new LinkedBlockingQueue<>();
    private final CompletableFuture<LiveSessionState> termination = new CompletableFuture<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final AtomicBoolean endCalled = new AtomicBoolean(false);
    private final AtomicBoolean packetHeartbeatPending = new AtomicBoolean(false);
    private final AtomicBoolean apiHeartbeatPending = new AtomicBoolean(false);

    private volatile LiveSessionState state = LiveSessionState.STARTING;
    private volatile LiveSocketPort.LiveSocket socket;
    private ScheduledExecutorService heartbeatScheduler;
    private Thread loopThread;

    LiveSession(LiveSessionInfo info, String authBody, OpenPlatformPort openPlatform, PacketCodec codec,
            LiveEventDispatcher dispatcher, Duration packetHeartbeatInterval, Duration apiHeartbeatInterval) {
        this.info = info;
        this.authBody = authBody != null ? authBody : "";
        this.openPlatform = openPlatform;
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.packetHeartbeatInterval = packetHeartbeatInterval;
        this.apiHeartbeatInterval = apiHeartbeatInterval;
    }

    public LiveSessionInfo info() {
        return info;
    }

    public LiveSessionState state() {
        return state;
    }

    /**
     * Completes with {@code CLOSED} once the loop has unwound, or exceptionally
     * with {@link LiveTransportException} after a socket failure.
     */
    public CompletableFuture<LiveSessionState> termination() {
        return termination;
    }

    /**
     * Request a graceful shutdown. Safe to call more than once and from any
     * thread; the loop notices it before handling its next signal.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("[Live] Stop requested for session {}", info.sessionId());
        }
        signals.offer(SessionSignal.CANCEL);
    }

    /**
     * Tear the session down without the {@code end} call.
     */
    public void abort() {
        if (!aborted.compareAndSet(false, true)) {
            return;
        }
        log.warn("[Live] Aborting session {}; server-side session is not ended", info.sessionId());
        cancelled.set(true);
        stopHeartbeats();
        LiveSocketPort.LiveSocket current = socket;
        if (current != null) {
            current.cancel();
        }
        Thread thread = loopThread;
        if (thread != null) {
            thread.interrupt();
        } else {
            finish(null);
        }
    }

    void connect(LiveSocketPort socketPort, String socketUrl) {
        String url = subscriptionUrl(socketUrl);
        log.info("[Live] Connecting session {} to {}", info.sessionId(), url);
        socket = socketPort.connect(url, new SignalListener());
        state = LiveSessionState.CONNECTED;

        if (!socket.send(codec.encode(PacketOperation.AUTH, authBody.getBytes(StandardCharsets.UTF_8)))) {
            socket.cancel();
            throw new LiveConnectException("Failed to send auth packet to " + url);
        }
        state = LiveSessionState.LISTENING;
    }

    void startLoop() {
        heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "live-heartbeat-" + info.sessionId());
            t.setDaemon(true);
            return t;
        });
        schedule(packetHeartbeatInterval, packetHeartbeatPending, SessionSignal.PACKET_HEARTBEAT);
        schedule(apiHeartbeatInterval, apiHeartbeatPending, SessionSignal.API_HEARTBEAT);

        loopThread = new Thread(this::runLoop, "live-session-" + info.sessionId());
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("[Live] Session {} listening (packet heartbeat {}s, api heartbeat {}s)", info.sessionId(),
                packetHeartbeatInterval.toSeconds(), apiHeartbeatInterval.toSeconds());
    }

    /**
     * Append the subscription path unless the URL already ends with it.
     */
    static String subscriptionUrl(String url) {
        if (url.endsWith("/sub")) {
            return url;
        }
        return url.endsWith("/") ? url + "sub" : url + "/sub";
    }

    // Coalesces ticks: at most one pending signal per timer while the loop is busy.
    private void schedule(Duration interval, AtomicBoolean pending, SessionSignal signal) {
        long millis = interval.toMillis();
        heartbeatScheduler.scheduleAtFixedRate(() -> {
            if (pending.compareAndSet(false, true)) {
                signals.offer(signal);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
    }

    private void runLoop() {
        Throwable failure = null;
        try {
            while (!cancelled.get()) {
                SessionSignal signal = signals.take();
                if (cancelled.get()) {
                    break;
                }
                failure = handle(signal);
                if (failure != null || signal.kind() == SessionSignal.Kind.CLOSED) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[Live] Session {} loop interrupted", info.sessionId());
        } catch (RuntimeException e) {
            log.error("[Live] Session {} loop crashed", info.sessionId(), e);
            failure = e;
        } finally {
            finish(failure);
        }
    }

    private Throwable handle(SessionSignal signal) {
        switch (signal.kind()) {
        case PACKET_HEARTBEAT -> sendPacketHeartbeat();
        case API_HEARTBEAT -> sendApiHeartbeat();
        case BINARY -> handleBinary(signal.data());
        case TEXT -> log.debug("[Live] Text message ignored: {}", signal.text());
        case CLOSED -> log.info("[Live] Socket closed by server: {} {}", signal.code(), signal.text());
        case FAILURE -> {
            log.warn("[Live] Socket failure on session {}: {}", info.sessionId(), signal.error().getMessage());
            return new LiveTransportException("Push socket failed: " + signal.error().getMessage(),
                    signal.error());
        }
        case CANCEL -> log.debug("[Live] Cancel signal");
        default -> log.debug("[Live] Unhandled signal {}", signal.kind());
        }
        return null;
    }

    private void sendPacketHeartbeat() {
        packetHeartbeatPending.set(false);
        if (!socket.send(codec.encode(PacketOperation.HEARTBEAT, new byte[0]))) {
            log.warn("[Live] Failed to send heartbeat packet on session {}", info.sessionId());
        }
    }

    private void sendApiHeartbeat() {
        apiHeartbeatPending.set(false);
        try {
            openPlatform.heartbeat(info.sessionId());
        } catch (RuntimeException e) {
            log.warn("[Live] API heartbeat failed for session {}: {}", info.sessionId(), e.getMessage());
        }
    }

    private void handleBinary(byte[] data) {
        List<Packet> packets;
        try {
            packets = codec.decode(data);
        } catch (LiveProtocolException e) {
            log.warn("[Live] Dropping malformed message ({} bytes): {}", data.length, e.getMessage());
            return;
        }
        for (Packet packet : packets) {
            try {
                dispatcher.dispatch(packet);
            } catch (RuntimeException e) {
                log.warn("[Live] Failed to dispatch {}: {}", packet, e.getMessage());
            }
        }
    }

    private synchronized void finish(Throwable failure) {
        if (termination.isDone()) {
            return;
        }
        state = LiveSessionState.SHUTTING_DOWN;
        stopHeartbeats();

        if (!aborted.get()) {
            endOnce();
        }

        LiveSocketPort.LiveSocket current = socket;
        if (current != null) {
            if (failure == null && !aborted.get()) {
                current.close(NORMAL_CLOSURE, "client shutdown");
            } else {
                current.cancel();
            }
        }

        if (failure == null) {
            state = LiveSessionState.CLOSED;
            log.info("[Live] Session {} closed", info.sessionId());
            termination.complete(LiveSessionState.CLOSED);
        } else {
            state = LiveSessionState.FAILED;
            log.warn("[Live] Session {} failed: {}", info.sessionId(), failure.getMessage());
            termination.completeExceptionally(failure);
        }
    }

    private void endOnce() {
        if (!endCalled.compareAndSet(false, true)) {
            return;
        }
        try {
            openPlatform.end(info.sessionId());
        } catch (RuntimeException e) {
            log.warn("[Live] End call failed for session {}: {}", info.sessionId(), e.getMessage());
        }
    }

    private void stopHeartbeats() {
        ScheduledExecutorService scheduler = heartbeatScheduler;
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    private final class SignalListener implements LiveSocketPort.Listener {

        @Override
        public void onBinary(byte[] data) {
            signals.offer(SessionSignal.binary(data));
        }

        @Override
        public void onText(String text) {
            signals.offer(SessionSignal.text(text));
        }

        @Override
        public void onClosed(int code, String reason) {
            signals.offer(SessionSignal.closed(code, reason));
        }

        @Override
        public void onFailure(Throwable error) {
            signals.offer(SessionSignal.failure(error));
        }
    }
}
