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

package me.golemcore.livebridge.protocol;

/**
 * Operation codes of the push protocol. Codes outside this set are kept as raw
 * numbers by the codec and never rejected.
 */
public final class PacketOperation {

    public static final long HEARTBEAT = 2;
    public static final long HEARTBEAT_REPLY = 3;
    public static final long SEND_EVENT = 5;
    public static final long AUTH = 7;
    public static final long AUTH_REPLY = 8;

    private PacketOperation() {
    }

    public static String describe(long operation) {
        if (operation == HEARTBEAT) {
            return "HEARTBEAT";
        } else if (operation == HEARTBEAT_REPLY) {
            return "HEARTBEAT_REPLY";
        } else if (operation == SEND_EVENT) {
            return "SEND_EVENT";
        } else if (operation == AUTH) {
            return "AUTH";
        } else if (operation == AUTH_REPLY) {
            return "AUTH_REPLY";
        }
        return "UNKNOWN(" + operation + ")";
    }
}
