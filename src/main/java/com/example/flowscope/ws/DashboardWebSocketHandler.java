package com.example.flowscope.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Dashboard endpoint. Pushes one snapshot as soon as a client connects, then leaves the
 * periodic updates to {@link DashboardLiveHub}. Understands {@code ping} and
 * {@code request_metrics}; any other message type is ignored.
 */
@Component
public class DashboardWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(DashboardWebSocketHandler.class);

    private static final int LOGGED_PAYLOAD_CHARS = 64;

    private final DashboardLiveHub hub;
    private final ObjectMapper mapper = new ObjectMapper();

    public DashboardWebSocketHandler(DashboardLiveHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        hub.add(session);
        log.info("DASHBOARD ws connected. sessionId={} total={}", session.getId(), hub.clientCount());
        if (!hub.pushLatest(session.getId())) {
            log.warn("Initial metrics push failed. sessionId={}", session.getId());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonNode root;
        try {
            root = mapper.readTree(message.getPayload());
        } catch (IOException e) {
            String payload = message.getPayload();
            log.warn("Invalid JSON from dashboard client. sessionId={} length={} head={}",
                    session.getId(), payload.length(), abbreviate(payload));
            return;
        }

        String type = root.path("type").asText("");
        if ("ping".equals(type)) {
            ObjectNode pong = mapper.createObjectNode();
            pong.put("type", "pong");
            JsonNode ts = root.get("timestamp");
            pong.set("timestamp", ts == null ? NullNode.getInstance() : ts);
            hub.sendTo(session.getId(), pong.toString());
        } else if ("request_metrics".equals(type)) {
            hub.pushLatest(session.getId());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        hub.remove(session.getId());
        log.info("DASHBOARD ws transport error. sessionId={} err={}", session.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.remove(session.getId());
        log.info("DASHBOARD ws closed. sessionId={} status={} total={}", session.getId(), status, hub.clientCount());
    }

    private static String abbreviate(String payload) {
        return payload.length() <= LOGGED_PAYLOAD_CHARS ? payload : payload.substring(0, LOGGED_PAYLOAD_CHARS) + "...";
    }
}
