package com.example.flowscope.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "flowscope.dashboard.broadcast-interval-ms=60000")
class DashboardWebSocketIntegrationTest {

    private final ObjectMapper om = new ObjectMapper();
    private final List<WebSocketSession> opened = new ArrayList<>();

    @LocalServerPort
    private int port;

    @Autowired
    private DashboardLiveHub hub;

    @AfterEach
    void closeClients() throws Exception {
        for (WebSocketSession s : opened) {
            if (s.isOpen()) s.close(CloseStatus.NORMAL);
        }
    }

    private BlockingQueue<String> connect() throws Exception {
        BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
        WebSocketSession session = new StandardWebSocketClient()
                .doHandshake(new TextWebSocketHandler() {
                    @Override
                    protected void handleTextMessage(WebSocketSession s, TextMessage message) {
                        inbox.add(message.getPayload());
                    }
                }, "ws://localhost:" + port + "/ws")
                .get(5, TimeUnit.SECONDS);
        opened.add(session);
        return inbox;
    }

    private WebSocketSession last() {
        return opened.get(opened.size() - 1);
    }

    private JsonNode next(BlockingQueue<String> inbox) throws Exception {
        String payload = inbox.poll(3, TimeUnit.SECONDS);
        assertThat(payload).as("message within 3s").isNotNull();
        return om.readTree(payload);
    }

    @Test
    void newClientGetsASnapshotImmediately() throws Exception {
        BlockingQueue<String> inbox = connect();

        JsonNode snap = next(inbox);

        assertThat(snap.has("system")).isTrue();
        assertThat(snap.has("actions")).isTrue();
        assertThat(snap.has("events")).isTrue();
        assertThat(snap.get("system").get("thread_count").asInt()).isPositive();
        assertThat(snap.get("actions").get("success_rate").asDouble()).isEqualTo(100.0);
    }

    @Test
    void pingIsAnsweredWithPongEchoingTheTimestamp() throws Exception {
        BlockingQueue<String> inbox = connect();
        next(inbox);

        last().sendMessage(new TextMessage("{\"type\":\"ping\",\"timestamp\":1234.5}"));
        JsonNode pong = next(inbox);

        assertThat(pong.get("type").asText()).isEqualTo("pong");
        assertThat(pong.get("timestamp").asDouble()).isEqualTo(1234.5);
    }

    @Test
    void pingWithoutTimestampEchoesNull() throws Exception {
        BlockingQueue<String> inbox = connect();
        next(inbox);

        last().sendMessage(new TextMessage("{\"type\":\"ping\"}"));
        JsonNode pong = next(inbox);

        assertThat(pong.get("type").asText()).isEqualTo("pong");
        assertThat(pong.get("timestamp").isNull()).isTrue();
    }

    @Test
    void requestMetricsPushesAFreshSnapshot() throws Exception {
        BlockingQueue<String> inbox = connect();
        next(inbox);

        last().sendMessage(new TextMessage("{\"type\":\"request_metrics\"}"));
        JsonNode snap = next(inbox);

        assertThat(snap.has("system")).isTrue();
    }

    @Test
    void unknownAndMalformedMessagesAreIgnored() throws Exception {
        BlockingQueue<String> inbox = connect();
        next(inbox);

        last().sendMessage(new TextMessage("{\"type\":\"subscribe\"}"));
        last().sendMessage(new TextMessage("not json"));
        last().sendMessage(new TextMessage("{\"type\":\"ping\",\"timestamp\":7}"));

        JsonNode reply = next(inbox);
        assertThat(reply.get("type").asText()).isEqualTo("pong");
        assertThat(last().isOpen()).isTrue();
    }

    @Test
    void closedClientIsUnregistered() throws Exception {
        BlockingQueue<String> inbox = connect();
        next(inbox);
        int before = hub.clientCount();

        last().close(CloseStatus.NORMAL);

        long deadline = System.currentTimeMillis() + 3000;
        while (hub.clientCount() >= before && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(hub.clientCount()).isLessThan(before);
    }
}
