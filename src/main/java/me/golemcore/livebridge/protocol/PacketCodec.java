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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Encoder/decoder for the push protocol's binary framing.
 *
 * <p>
 * Wire layout, all fields big-endian:
 *
 * <pre>
 * 0      4        6         8           12         16
 * +------+--------+---------+-----------+----------+---------
 * | len  | header | version | operation | sequence | body...
 * | u32  | u16    | u16     | u32       | u32      |
 * +------+--------+---------+-----------+----------+---------
 * </pre>
 *
 * <p>
 * A buffer may carry several packets back to back. A packet with version
 * {@link #VERSION_ZLIB} holds a zlib stream whose inflated content is itself a
 * sequence of packets; {@link #decode(byte[])} flattens those into the result.
 * Inflation is bounded both in size and in nesting depth.
 *
 * <p>
 * Instances are immutable and thread-safe.
 */
public class PacketCodec {

    public static final int HEADER_LENGTH = 16;
    public static final int VERSION_PLAIN = 1;
    public static final int VERSION_ZLIB = 2;
    public static final int DEFAULT_MAX_INFLATED_BYTES = 16 * 1024 * 1024;
    public static final int DEFAULT_MAX_DEPTH = 4;

    private static final int CLIENT_SEQUENCE = 1;
    private static final int INFLATE_CHUNK = 8192;

    private final int maxInflatedBytes;
    private final int maxDepth;

    public PacketCodec() {
        this(DEFAULT_MAX_INFLATED_BYTES, DEFAULT_MAX_DEPTH);
    }

    public PacketCodec(int maxInflatedBytes, int maxDepth) {
        if (maxInflatedBytes <= 0) {
            throw new IllegalArgumentException("maxInflatedBytes must be positive");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1");
        }
        this.maxInflatedBytes = maxInflatedBytes;
        this.maxDepth = maxDepth;
    }

    /**
     * Encode a client packet. Client packets are always plain and carry sequence
     * 1; the server does not require unique sequence numbers for control
     * packets.
     */
    public byte[] encode(long operation, byte[] body) {
        byte[] payload = body != null ? body : new byte[0];
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH + payload.length);
        buffer.putInt(HEADER_LENGTH + payload.length);
        buffer.putShort((short) HEADER_LENGTH);
        buffer.putShort((short) VERSION_PLAIN);
        buffer.putInt((int) operation);
        buffer.putInt(CLIENT_SEQUENCE);
        buffer.put(payload);
        return buffer.array();
    }

    /**
     * Decode every complete packet in {@code data}.
     *
     * <p>
     * Scanning stops silently at a trailing fragment shorter than a header, at a
     * packet declaring length 0, or at a packet extending past the end of the
     * buffer. Packets already decoded before that point are returned.
     *
     * <p>
     * The body starts at the declared header length, which may be shorter than
     * {@link #HEADER_LENGTH}.
     *
     * @throws LiveProtocolException
     *             if a header length exceeds its packet length or a compressed container cannot
     *             be inflated within the configured limits
     */
    public List<Packet> decode(byte[] data) throws LiveProtocolException {
        List<Packet> packets = new ArrayList<>();
        if (data != null) {
            decodeInto(data, 1, packets);
        }
        return packets;
    }

    private void decodeInto(byte[] data, int depth, List<Packet> out) throws LiveProtocolException {
        ByteBuffer buffer = ByteBuffer.wrap(data);
        int offset = 0;

        while (data.length - offset >= HEADER_LENGTH) {
            long packetLength = Integer.toUnsignedLong(buffer.getInt(offset));
            if (packetLength == 0 || packetLength > data.length - offset) {
                break;
            }

            int headerLength = Short.toUnsignedInt(buffer.getShort(offset + 4));
            int version = Short.toUnsignedInt(buffer.getShort(offset + 6));
            long operation = Integer.toUnsignedLong(buffer.getInt(offset + 8));
            long sequence = Integer.toUnsignedLong(buffer.getInt(offset + 12));

            if (headerLength > packetLength) {
                throw new LiveProtocolException("Malformed packet at offset " + offset
                        + ": header length " + headerLength + ", packet length " + packetLength);
            }

            int end = offset + (int) packetLength;
            byte[] body = Arrays.copyOfRange(data, offset + headerLength, end);

            if (version == VERSION_ZLIB) {
                if (depth >= maxDepth) {
                    throw new LiveProtocolException("Compressed packets nested deeper than " + maxDepth);
                }
                decodeInto(inflate(body), depth + 1, out);
            } else {
                out.add(new Packet(packetLength, headerLength, version, operation, sequence, body));
            }

            offset = end;
        }
    }

    private byte[] inflate(byte[] compressed) throws LiveProtocolException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.min(compressed.length * 4, maxInflatedBytes));
            byte[] chunk = new byte[INFLATE_CHUNK];
            while (!inflater.finished()) {
                int n = inflater.inflate(chunk);
                if (n == 0) {
                    if (inflater.needsInput() || inflater.needsDictionary()) {
                        throw new LiveProtocolException("Truncated compressed packet body");
                    }
                    continue;
                }
                if (out.size() + n > maxInflatedBytes) {
                    throw new LiveProtocolException("Compressed packet inflates beyond " + maxInflatedBytes + " bytes");
                }
                out.write(chunk, 0, n);
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new LiveProtocolException("Corrupt compressed packet body: " + e.getMessage(), e);
        } finally {
            inflater.end();
        }
    }
}
