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

import java.util.Arrays;

/**
 * One decoded unit of the push protocol: a 16-byte big-endian header followed
 * by a body.
 *
 * <p>
 * Unsigned header fields are widened to {@code long}/{@code int} so that values
 * above {@code Integer.MAX_VALUE} survive decoding unchanged.
 *
 * @param packetLength
 *            total length of header and body
 * @param headerLength
 *            header length, normally {@link PacketCodec#HEADER_LENGTH}
 * @param version
 *            body encoding, see {@link PacketCodec#VERSION_PLAIN} and
 *            {@link PacketCodec#VERSION_ZLIB}
 * @param operation
 *            operation code, see {@link PacketOperation}
 * @param sequence
 *            sequence id as sent by the peer
 * @param body
 *            raw body bytes, copied on construction and on access
 */
public record Packet(long packetLength, int headerLength, int version, long operation, long sequence,
        byte[] body) {

    public Packet {
        body = body != null ? body.clone() : new byte[0];
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public boolean is(long op) {
        return operation == op;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Packet packet)) {
            return false;
        }
        return packetLength == packet.packetLength
                && headerLength == packet.headerLength
                && version == packet.version
                && operation == packet.operation
                && sequence == packet.sequence
                && Arrays.equals(body, packet.body);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(packetLength);
        result = 31 * result + headerLength;
        result = 31 * result + version;
        result = 31 * result + Long.hashCode(operation);
        result = 31 * result + Long.hashCode(sequence);
        return 31 * result + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "Packet[op=" + PacketOperation.describe(operation) + ", len=" + packetLength
                + ", header=" + headerLength + ", ver=" + version + ", seq=" + sequence
                + ", body=" + body.length + "B]";
    }
}
