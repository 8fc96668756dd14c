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

/**
 * One unit of work for the session loop. Timers, the socket listener and the
 * cancellation path all feed the same queue, so the loop waits on a single
 * source.
 */
record SessionSignal(Kind kind, byte[] data, String text, int code, Throwable error) {

    enum Kind {
        PACKET_HEARTBEAT, API_HEARTBEAT, BINARY, TEXT, CLOSED, FAILURE, CANCEL
    }

    static final SessionSignal PACKET_HEARTBEAT = new SessionSignal(Kind.PACKET_HEARTBEAT, null, null, 0, null);
    static final SessionSignal API_HEARTBEAT = new SessionSignal(Kind.API_HEARTBEAT, null, null, 0, null);
    static final SessionSignal CANCEL = new SessionSignal(Kind.CANCEL, null, null, 0, null);

    static SessionSignal binary(byte[] data) {
        return new SessionSignal(Kind.BINARY, data, null, 0, null);
    }

    static SessionSignal text(String text) {
        return new SessionSignal(Kind.TEXT, null, text, 0, null);
    }

    static SessionSignal closed(int code, String reason) {
        return new SessionSignal(Kind.CLOSED, null, reason, code, null);
    }

    static SessionSignal failure(Throwable error) {
        return new SessionSignal(Kind.FAILURE, null, null, 0, error);
    }
}
