package com.p14n.relay.vertx;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.relay.codec.FrameEncoder;
import com.p14n.relay.data.ConfigData;
import com.p14n.relay.registry.ChannelRegistry;
import com.p14n.relay.vertx.auth.JwtCredentialVerifier;

import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.UpgradeRejectedException;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 20, unit = TimeUnit.SECONDS)
class VertxRelayServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private Vertx vertx;
    private ChannelRegistry registry;
    private VertxRelayServer server;
    private WebSocketClient wsClient;
    private HttpClient httpClient;
    private int port;

    @BeforeEach
    void setUp() throws InterruptedException {
        vertx = Vertx.vertx();
        var config = new ConfigData(0, TestTokens.SECRET);
        registry = new ChannelRegistry(config, new FrameEncoder(), OpenTelemetry.noop(), "test");
        server = new VertxRelayServer(vertx, config, registry, new JwtCredentialVerifier(TestTokens.SECRET),
                OpenTelemetry.noop());
        port = server.start();
        wsClient = vertx.createWebSocketClient();
        httpClient = vertx.createHttpClient();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.close();
        await(vertx.close());
    }

    private static <T> T await(Future<T> future) throws InterruptedException, ExecutionException {
        try {
            return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        } catch (java.util.concurrent.TimeoutException e) {
            throw new AssertionError("Timed out waiting for Vert.x", e);
        }
    }

    private WebSocket connect(String token, BlockingQueue<JsonNode> frames) throws Exception {
        var socket = await(wsClient.connect(port, "localhost", "/?token=" + token));
        socket.textMessageHandler(text -> {
            try {
                frames.add(mapper.readTree(text));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        return socket;
    }

    private JsonNode next(BlockingQueue<JsonNode> frames, String event) throws InterruptedException {
        while (true) {
            var frame = frames.poll(5, TimeUnit.SECONDS);
            assertNotNull(frame, "No " + event + " frame received");
            if (event.equals(frame.get("event").asText())) {
                return frame;
            }
        }
    }

    private record Reply(int status, String body) {
    }

    private Reply request(HttpMethod method, String path, String body) throws Exception {
        return await(httpClient.request(method, port, "localhost", path)
                .compose(req -> {
                    var sent = body == null
                            ? req.send()
                            : req.putHeader("Content-Type", "application/json").send(Buffer.buffer(body));
                    return sent.compose(resp -> resp.body().map(b -> new Reply(resp.statusCode(), b.toString())));
                }));
    }

    private int post(String body, StringBuilder responseBody) throws Exception {
        var reply = request(HttpMethod.POST, "/api/broadcast", body);
        responseBody.append(reply.body());
        return reply.status();
    }

    @Test
    void shouldRejectUpgradeWithoutValidToken() {
        var missing = assertThrows(ExecutionException.class,
                () -> await(wsClient.connect(port, "localhost", "/")));
        assertInstanceOf(UpgradeRejectedException.class, missing.getCause());
        assertEquals(401, ((UpgradeRejectedException) missing.getCause()).getStatus());

        var invalid = assertThrows(ExecutionException.class,
                () -> await(wsClient.connect(port, "localhost", "/?token=garbage")));
        assertEquals(401, ((UpgradeRejectedException) invalid.getCause()).getStatus());
        assertEquals(0, server.connectionStats().totalConnections());
    }

    @Test
    void shouldRelayBroadcastToSubscriber() throws Exception {
        BlockingQueue<JsonNode> frames = new LinkedBlockingQueue<>();
        var socket = connect(TestTokens.token("u1"), frames);
        socket.writeTextMessage("{\"type\":\"subscribe\",\"channelName\":\"general\",\"userId\":\"u1\"}");

        var presence = next(frames, "MEMBER_STATUS_UPDATE");
        assertEquals("u1", presence.get("data").get("userId").asText());
        assertTrue(presence.get("data").get("isOnline").asBoolean());

        var body = new StringBuilder();
        var status = post("{\"type\":\"new-message\",\"channelName\":\"general\",\"message\":{\"id\":\"m1\"}}",
                body);
        assertEquals(200, status);
        assertEquals(1, mapper.readTree(body.toString()).get("delivered").asInt());
        assertTrue(mapper.readTree(body.toString()).get("success").asBoolean());

        var message = next(frames, "new-message");
        assertEquals("m1", message.get("data").get("id").asText());

        socket.writeTextMessage("{\"type\":\"typing\",\"channelName\":\"general\",\"isTyping\":true}");
        var typing = next(frames, "member-typing");
        assertEquals("Name of u1", typing.get("data").get("typingUsers").get(0).get("username").asText());
    }

    @Test
    void shouldRejectInvalidBroadcastRequests() throws Exception {
        var body = new StringBuilder();
        assertEquals(400, post("{\"type\":\"shout\",\"channelName\":\"general\",\"message\":{}}", body));
        assertTrue(mapper.readTree(body.toString()).get("error").asText().startsWith("Invalid event type"));

        body.setLength(0);
        assertEquals(400, post("{\"type\":\"new-message\",\"message\":{}}", body));
        assertEquals("Missing required fields: type, channelName, or message",
                mapper.readTree(body.toString()).get("error").asText());

        body.setLength(0);
        assertEquals(200, post("{\"type\":\"new-message\",\"channelName\":\"empty\",\"message\":{}}", body));
        assertEquals(0, mapper.readTree(body.toString()).get("delivered").asInt());
    }

    @Test
    void shouldRejectOversizedBroadcastBody() throws Exception {
        var padding = "x".repeat((int) VertxRelayServer.MAX_BODY_BYTES);
        var body = new StringBuilder();

        var status = post("{\"type\":\"new-message\",\"channelName\":\"general\",\"message\":{\"text\":\""
                + padding + "\"}}", body);

        assertEquals(413, status);
    }

    @Test
    void shouldReportHealthAndTearDownOnClose() throws Exception {
        BlockingQueue<JsonNode> frames = new LinkedBlockingQueue<>();
        var socket = connect(TestTokens.token("u1"), frames);
        socket.writeTextMessage("{\"type\":\"subscribe\",\"channelName\":\"general\",\"userId\":\"u1\"}");
        next(frames, "MEMBER_STATUS_UPDATE");

        var reply = request(HttpMethod.GET, "/health", null);
        var health = mapper.readTree(reply.body());
        assertEquals(200, reply.status());
        assertEquals("healthy", health.get("status").asText());
        assertEquals(1, health.get("activeConnections").asInt());
        assertEquals(1, health.get("totalConnections").asInt());
        assertEquals(1, health.get("totalChannels").asInt());
        assertEquals("general", health.get("channels").get(0).get("name").asText());
        assertEquals(1, health.get("channels").get(0).get("subscribers").asInt());

        await(socket.close());

        long deadline = System.currentTimeMillis() + 5000;
        while (registry.connectionCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(0, registry.connectionCount());
        assertEquals(0, registry.getStats().totalChannels());
        while (server.connectionStats().activeConnections() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(0, server.connectionStats().activeConnections());
    }
}
