package me.golemcore.livebridge.adapter.outbound.openplatform;

import me.golemcore.livebridge.domain.exception.LiveApiException;
import me.golemcore.livebridge.domain.exception.LiveConfigException;
import me.golemcore.livebridge.domain.model.StartedSession;
import me.golemcore.livebridge.infrastructure.config.BotProperties;
import me.golemcore.livebridge.infrastructure.http.FeignClientFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenPlatformClientTest {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";
    private static final String START_OK = """
            {"code":0,"message":"ok","request_id":"r1","data":{
              "game_info":{"game_id":"game-123"},
              "websocket_info":{"auth_body":"{\\"key\\":\\"v\\"}",
                "wss_link":["wss://a.example/sub","wss://b.example/sub"]},
              "anchor_info":{"room_id":4242,"uname":"Streamer","open_id":"open-1","uface":"x"}}}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private MockWebServer mockServer;
    private BotProperties properties;
    private OpenPlatformClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        properties = new BotProperties();
        properties.getLive().setAccessKey("key");
        properties.getLive().setAccessSecret("secret");
        properties.getLive().setAppId(42L);
        properties.getLive().setHost(mockServer.url("/").toString());

        FeignClientFactory factory = new FeignClientFactory(new OkHttpClient(), objectMapper);
        client = new OpenPlatformClient(properties, factory,
                new OpenPlatformSigner("key", "secret", clock, () -> "nonce-1"));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void startShouldReturnSessionDetails() {
        mockServer.enqueue(json(START_OK));

        StartedSession session = client.start("IDCODE");

        assertEquals("game-123", session.sessionId());
        assertEquals(List.of("wss://a.example/sub", "wss://b.example/sub"), session.socketUrls());
        assertEquals("{\"key\":\"v\"}", session.authBody());
        assertEquals(4242L, session.anchor().roomId());
        assertEquals("Streamer", session.anchor().name());
        assertEquals("open-1", session.anchor().openId());
    }

    @Test
    void startShouldSendSignedJsonBody() throws Exception {
        mockServer.enqueue(json(START_OK));

        client.start("IDCODE");

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("POST", request.getMethod());
        assertEquals("/v2/app/start", request.getPath());
        String body = request.getBody().readUtf8();
        JsonNode json = objectMapper.readTree(body);
        assertEquals("IDCODE", json.get("code").asText());
        assertEquals(42L, json.get("app_id").asLong());

        assertTrue(request.getHeader(CONTENT_TYPE).startsWith(APPLICATION_JSON));
        assertEquals("key", request.getHeader("x-bili-accesskeyid"));
        assertEquals(OpenPlatformSigner.md5Hex(body.getBytes(StandardCharsets.UTF_8)),
                request.getHeader("x-bili-content-md5"));
        assertEquals("nonce-1", request.getHeader("x-bili-signature-nonce"));
        assertEquals("1772366400", request.getHeader("x-bili-timestamp"));

        Map<String, String> expected = new OpenPlatformSigner("key", "secret", clock, () -> "nonce-1")
                .sign(body.getBytes(StandardCharsets.UTF_8));
        assertEquals(expected.get("Authorization"), request.getHeader("Authorization"));
    }

    @Test
    void startShouldFailOnNonZeroCode() {
        mockServer.enqueue(json("{\"code\":7001,\"message\":\"bad code\",\"data\":null}"));

        LiveApiException error = assertThrows(LiveApiException.class, () -> client.start("IDCODE"));

        assertEquals(7001, error.getCode());
        assertTrue(error.getMessage().contains("bad code"));
    }

    @Test
    void startShouldFailOnMissingData() {
        mockServer.enqueue(json("{\"code\":0,\"message\":\"ok\"}"));

        assertThrows(LiveApiException.class, () -> client.start("IDCODE"));
    }

    @Test
    void startShouldFailOnHttpError() {
        mockServer.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        LiveApiException error = assertThrows(LiveApiException.class, () -> client.start("IDCODE"));

        assertEquals(LiveApiException.NO_CODE, error.getCode());
        assertEquals(1, mockServer.getRequestCount());
    }

    @Test
    void startShouldTolerateMissingAnchor() {
        mockServer.enqueue(json("""
                {"code":0,"data":{"game_info":{"game_id":"g"},
                  "websocket_info":{"auth_body":"a","wss_link":[]}}}
                """));

        StartedSession session = client.start("IDCODE");

        assertTrue(session.socketUrls().isEmpty());
        assertNull(session.anchor().roomId());
    }

    @Test
    void startShouldRequireAppId() {
        properties.getLive().setAppId(null);

        assertThrows(LiveConfigException.class, () -> client.start("IDCODE"));
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void heartbeatShouldPostSessionId() throws Exception {
        mockServer.enqueue(json("{\"code\":0,\"message\":\"ok\",\"data\":{}}"));

        client.heartbeat("game-123");

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("/v2/app/heartbeat", request.getPath());
        assertEquals("game-123", objectMapper.readTree(request.getBody().readUtf8()).get("game_id").asText());
    }

    @Test
    void heartbeatShouldNotThrowOnNonZeroCode() {
        mockServer.enqueue(json("{\"code\":7003,\"message\":\"expired\"}"));

        assertDoesNotThrow(() -> client.heartbeat("game-123"));
    }

    @Test
    void endShouldPostAppIdAndSessionId() throws Exception {
        mockServer.enqueue(json("{\"code\":0,\"message\":\"ok\",\"data\":{}}"));

        client.end("game-123");

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("/v2/app/end", request.getPath());
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals(42L, body.get("app_id").asLong());
        assertEquals("game-123", body.get("game_id").asText());
    }

    @Test
    void endShouldNotThrowOnNonZeroCode() {
        mockServer.enqueue(json("{\"code\":7000,\"message\":\"unknown game\"}"));

        assertDoesNotThrow(() -> client.end("game-123"));
    }

    private static MockResponse json(String body) {
        return new MockResponse().setBody(body).setHeader(CONTENT_TYPE, APPLICATION_JSON);
    }
}
