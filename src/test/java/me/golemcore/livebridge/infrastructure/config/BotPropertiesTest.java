package me.golemcore.livebridge.infrastructure.config;

import me.golemcore.livebridge.protocol.PacketCodec;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BotPropertiesTest {

    @Test
    void shouldUseDefaultHostWhenUnset() {
        BotProperties.LiveProperties live = new BotProperties().getLive();

        assertEquals("https://live-open.biliapi.com", live.resolveHost());

        live.setHost(" ");
        assertEquals(BotProperties.LiveProperties.DEFAULT_HOST, live.resolveHost());
    }

    @Test
    void shouldStripTrailingSlashFromHost() {
        BotProperties.LiveProperties live = new BotProperties().getLive();
        live.setHost("http://localhost:8080/");

        assertEquals("http://localhost:8080", live.resolveHost());
    }

    @Test
    void shouldClampHeartbeatInterval() {
        BotProperties.LiveProperties live = new BotProperties().getLive();
        assertEquals(20, live.resolveHeartbeatIntervalSeconds());

        live.setHeartbeatIntervalSeconds(1);
        assertEquals(BotProperties.LiveProperties.MIN_HEARTBEAT_INTERVAL_SECONDS,
                live.resolveHeartbeatIntervalSeconds());
    }

    @Test
    void shouldRequireKeySecretAndAppId() {
        BotProperties.LiveProperties live = new BotProperties().getLive();
        assertFalse(live.hasCredentials());

        live.setAccessKey("key");
        live.setAccessSecret("secret");
        assertFalse(live.hasCredentials());

        live.setAppId(42L);
        assertTrue(live.hasCredentials());
    }

    @Test
    void shouldBuildCodecFromLimits() {
        BotProperties properties = new BotProperties();
        properties.getLive().setMaxInflatedBytes(2048);

        PacketCodec codec = new LiveConfiguration().packetCodec(properties);

        assertNotNull(codec);
    }
}
