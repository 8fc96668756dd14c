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

/**
 * Port for the binary push socket.
 */
public interface LiveSocketPort {

    /**
     * Open a socket to {@code url} and wait for the handshake to complete.
     *
     * @param url
     *            absolute ws/wss URL, already including the subscription path
     * @param listener
     *            receives inbound traffic; called from the transport's threads
     * @return an open socket
     * @throws me.golemcore.livebridge.domain.exception.LiveConnectException
     *             if the handshake fails or times out
     */
    LiveSocket connect(String url, Listener listener);

    interface LiveSocket {

        /**
         * Queue a binary message. Returns {@code false} if the socket is closing
         * or closed, or the outgoing buffer is full.
         */
        boolean send(byte[] data);

        /** Start a graceful close handshake. */
        void close(int code, String reason);

        /** Drop the connection immediately. */
        void cancel();
    }

    interface Listener {

        void onBinary(byte[] data);

        void onText(String text);

        /** The peer closed the socket, or the close handshake completed. */
        void onClosed(int code, String reason);

        void onFailure(Throwable error);
    }
}
