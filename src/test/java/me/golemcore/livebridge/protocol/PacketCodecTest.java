package me.golemcore.livebridge.protocol;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.zip.Deflater;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PacketCodecTest {

    private final PacketCodec codec = new PacketCodec();

    @Test
    void shouldEncodeHeartbeatAsBareHeader() {
        byte[] encoded = codec.encode(PacketOperation.HEARTBEAT, new byte[0]);

        assertArrayEquals(new byte[] {
                0, 0, 0, 16,
                0, 16,
                0, 1,
                0, 0, 0, 2,
                0, 0, 0, 1 }, encoded);
    }

    @Test
    void shouldEncodeAuthWithBody() {
        byte[] body = "{\"k\":1}".getBytes(StandardCharsets.UTF_8);

        byte[] encoded = codec.encode(PacketOperation.AUTH, body);

        ByteBuffer buffer = ByteBuffer.wrap(encoded);
        assertEquals(16 + body.length, buffer.getInt(0));
        assertEquals(7, buffer.getInt(8));
        assertArrayEquals(body, Arrays.copyOfRange(encoded, 16, encoded.length));
    }

    @Test
    void shouldDecodeWhatItEncodes() throws Exception {
        byte[] body = "hello".getBytes(StandardCharsets.UTF_8);

        List<Packet> packets = codec.decode(codec.encode(PacketOperation.SEND_EVENT, body));

        assertEquals(1, packets.size());
        Packet packet = packets.get(0);
        assertEquals(21, packet.packetLength());
        assertEquals(16, packet.headerLength());
        assertEquals(PacketCodec.VERSION_PLAIN, packet.version());
        assertTrue(packet.is(PacketOperation.SEND_EVENT));
        assertEquals(1, packet.sequence());
        assertArrayEquals(body, packet.body());
    }

    @Test
    void shouldDecodeConcatenatedPacketsInOrder() throws Exception {
        byte[] data = concat(
                codec.encode(PacketOperation.HEARTBEAT_REPLY, new byte[] { 0, 0, 0, 7 }),
                codec.encode(PacketOperation.SEND_EVENT, "a".getBytes(StandardCharsets.UTF_8)),
                codec.encode(PacketOperation.AUTH_REPLY, "{\"code\":0}".getBytes(StandardCharsets.UTF_8)));

        List<Packet> packets = codec.decode(data);

        assertEquals(List.of(PacketOperation.HEARTBEAT_REPLY, PacketOperation.SEND_EVENT, PacketOperation.AUTH_REPLY),
                packets.stream().map(Packet::operation).toList());
    }

    @Test
    void shouldFlattenCompressedContainer() throws Exception {
        byte[] inner = concat(
                codec.encode(PacketOperation.SEND_EVENT, "{\"cmd\":\"A\"}".getBytes(StandardCharsets.UTF_8)),
                codec.encode(PacketOperation.SEND_EVENT, "{\"cmd\":\"B\"}".getBytes(StandardCharsets.UTF_8)));
        byte[] data = concat(
                codec.encode(PacketOperation.HEARTBEAT_REPLY, new byte[4]),
                packet(PacketCodec.VERSION_ZLIB, PacketOperation.SEND_EVENT, deflate(inner)));

        List<Packet> packets = codec.decode(data);

        assertEquals(3, packets.size());
        assertEquals(PacketOperation.HEARTBEAT_REPLY, packets.get(0).operation());
        assertEquals("{\"cmd\":\"A\"}", new String(packets.get(1).body(), StandardCharsets.UTF_8));
        assertEquals("{\"cmd\":\"B\"}", new String(packets.get(2).body(), StandardCharsets.UTF_8));
    }

    @Test
    void shouldStopAtTrailingFragment() throws Exception {
        byte[] data = concat(codec.encode(PacketOperation.HEARTBEAT, new byte[0]), new byte[] { 0, 0, 0 });

        assertEquals(1, codec.decode(data).size());
    }

    @Test
    void shouldStopAtPacketExtendingPastBuffer() throws Exception {
        byte[] full = codec.encode(PacketOperation.SEND_EVENT, "0123456789".getBytes(StandardCharsets.UTF_8));
        byte[] data = concat(codec.encode(PacketOperation.HEARTBEAT, new byte[0]),
                Arrays.copyOf(full, full.length - 3));

        List<Packet> packets = codec.decode(data);

        assertEquals(1, packets.size());
        assertEquals(PacketOperation.HEARTBEAT, packets.get(0).operation());
    }

    @Test
    void shouldStopAtZeroLengthPacket() throws Exception {
        assertTrue(codec.decode(new byte[32]).isEmpty());
    }

    @Test
    void shouldReturnEmptyForShortOrNullInput() throws Exception {
        assertTrue(codec.decode(new byte[0]).isEmpty());
        assertTrue(codec.decode(new byte[15]).isEmpty());
        assertTrue(codec.decode(null).isEmpty());
    }

    @Test
    void shouldUseDeclaredShortHeaderLengthAsBodyOffset() throws Exception {
        byte[] first = codec.encode(PacketOperation.SEND_EVENT, "ok".getBytes(StandardCharsets.UTF_8));
        byte[] second = codec.encode(PacketOperation.SEND_EVENT, new byte[] { 1, 2, 3, 4 });
        ByteBuffer.wrap(second).putShort(4, (short) 12);

        List<Packet> packets = codec.decode(concat(first, second));

        assertEquals(2, packets.size());
        assertArrayEquals("ok".getBytes(StandardCharsets.UTF_8), packets.get(0).body());
        Packet shortHeader = packets.get(1);
        assertEquals(20, shortHeader.packetLength());
        assertEquals(12, shortHeader.headerLength());
        assertArrayEquals(new byte[] { 0, 0, 0, 1, 1, 2, 3, 4 }, shortHeader.body());
    }

    @Test
    void shouldRejectHeaderLongerThanPacket() {
        byte[] data = codec.encode(PacketOperation.HEARTBEAT, new byte[4]);
        ByteBuffer.wrap(data).putShort(4, (short) 40);

        assertThrows(LiveProtocolException.class, () -> codec.decode(data));
    }

    @Test
    void shouldRejectCorruptCompressedBody() {
        byte[] data = packet(PacketCodec.VERSION_ZLIB, PacketOperation.SEND_EVENT, new byte[] { 1, 2, 3, 4, 5 });

        assertThrows(LiveProtocolException.class, () -> codec.decode(data));
    }

    @Test
    void shouldRejectTruncatedCompressedBody() {
        byte[] compressed = deflate(codec.encode(PacketOperation.SEND_EVENT, new byte[2048]));
        byte[] data = packet(PacketCodec.VERSION_ZLIB, PacketOperation.SEND_EVENT,
                Arrays.copyOf(compressed, compressed.length / 2));

        assertThrows(LiveProtocolException.class, () -> codec.decode(data));
    }

    @Test
    void shouldRejectInflationBeyondLimit() {
        PacketCodec limited = new PacketCodec(1024, PacketCodec.DEFAULT_MAX_DEPTH);
        byte[] inner = codec.encode(PacketOperation.SEND_EVENT, new byte[64 * 1024]);
        byte[] data = packet(PacketCodec.VERSION_ZLIB, PacketOperation.SEND_EVENT, deflate(inner));

        LiveProtocolException error = assertThrows(LiveProtocolException.class, () -> limited.decode(data));
        assertTrue(error.getMessage().contains("1024"));
    }

    @Test
    void shouldRejectNestingBeyondDepth() {
        PacketCodec shallow = new PacketCodec(PacketCodec.DEFAULT_MAX_INFLATED_BYTES, 2);
        byte[] level3 = codec.encode(PacketOperation.SEND_EVENT, "x".getBytes(StandardCharsets.UTF_8));
        byte[] level2 = packet(PacketCodec.VERSION_ZLIB, PacketOperation.SEND_EVENT, deflate(level3));
        byte[] level1 = packet(PacketCodec.VERSION_ZLIB, PacketOperation.SEND_EVENT, deflate(level2));

        assertThrows(LiveProtocolException.class, () -> shallow.decode(level1));
    }

    @Test
    void shouldAllowNestingWithinDepth() throws Exception {
        byte[] level2 = codec.encode(PacketOperation.SEND_EVENT, "x".getBytes(StandardCharsets.UTF_8));
        byte[] level1 = packet(PacketCodec.VERSION_ZLIB, PacketOperation.SEND_EVENT, deflate(level2));
        PacketCodec shallow = new PacketCodec(PacketCodec.DEFAULT_MAX_INFLATED_BYTES, 2);

        assertEquals(1, shallow.decode(level1).size());
    }

    @Test
    void shouldKeepUnsignedHeaderValues() throws Exception {
        byte[] data = codec.encode(PacketOperation.HEARTBEAT, new byte[0]);
        ByteBuffer.wrap(data).putInt(8, 0xFFFFFFFE).putInt(12, 0x80000000);

        Packet packet = codec.decode(data).get(0);

        assertEquals(4294967294L, packet.operation());
        assertEquals(2147483648L, packet.sequence());
    }

    @Test
    void shouldCopyPacketBodyOnConstructionAndAccess() {
        byte[] source = { 1, 2, 3 };
        Packet packet = new Packet(19, 16, PacketCodec.VERSION_PLAIN, PacketOperation.SEND_EVENT, 1, source);

        source[0] = 9;
        packet.body()[1] = 9;

        assertArrayEquals(new byte[] { 1, 2, 3 }, packet.body());
        assertEquals(new Packet(19, 16, PacketCodec.VERSION_PLAIN, PacketOperation.SEND_EVENT, 1,
                new byte[] { 1, 2, 3 }), packet);
    }

    @Test
    void shouldRejectInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> new PacketCodec(0, 4));
        assertThrows(IllegalArgumentException.class, () -> new PacketCodec(1024, 0));
    }

    private static byte[] packet(int version, long operation, byte[] body) {
        ByteBuffer buffer = ByteBuffer.allocate(16 + body.length);
        buffer.putInt(16 + body.length);
        buffer.putShort((short) 16);
        buffer.putShort((short) version);
        buffer.putInt((int) operation);
        buffer.putInt(0);
        buffer.put(body);
        return buffer.array();
    }

    private static byte[] deflate(byte[] data) {
        Deflater deflater = new Deflater();
        deflater.setInput(data);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] chunk = new byte[1024];
        while (!deflater.finished()) {
            int n = deflater.deflate(chunk);
            out.write(chunk, 0, n);
        }
        deflater.end();
        return out.toByteArray();
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }
}
