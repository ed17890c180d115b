package com.example.onetwoone.handler;

import com.example.onetwoone.error.ChatException;
import com.example.onetwoone.error.ProtocolViolationException;
import com.example.onetwoone.model.ChatMode;
import com.example.onetwoone.service.ChatService;
import com.example.onetwoone.service.DebateService;
import com.example.onetwoone.service.SignalKind;
import com.example.onetwoone.service.SignalingRelay;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * WebSocket handler for the chat endpoint.
 * - One connection id per socket (the WebSocket session id)
 * - Inbound frames are JSON objects {"type": ..., ...}; each type maps to one service call
 * - Rejected actions answer {"type":"error","code":...,"message":...}; the socket stays open
 * - Heartbeat: "ping" (raw or JSON) is answered with "pong"
 * - On close: signaling, debate and 1:1 state are released, in that order
 */
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    private final ChatService chat;
    private final DebateService debates;
    private final SignalingRelay relay;
    private final WebSocketGateway gateway;
    private final ObjectMapper mapper;

    public ChatWebSocketHandler(ChatService chat,
                                DebateService debates,
                                SignalingRelay relay,
                                WebSocketGateway gateway,
                                ObjectMapper mapper) {
        this.chat = chat;
        this.debates = debates;
        this.relay = relay;
        this.gateway = gateway;
        this.mapper = mapper;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        gateway.register(session);
        chat.connect(session.getId());
        log.info("WS OPEN sid={} remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        final String id = session.getId();
        final String payload = message.getPayload();

        // Raw heartbeat
        if ("ping".equals(payload)) {
            gateway.send(id, "pong", Map.of());
            return;
        }

        JsonNode node;
        try {
            node = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            replyError(id, "bad-request", "frame is not valid JSON");
            return;
        }
        if (node == null || !node.isObject()) {
            replyError(id, "bad-request", "frame must be a JSON object");
            return;
        }

        String type = text(node, "type");
        try {
            dispatch(id, type == null ? "" : type, node);
        } catch (ChatException e) {
            log.warn("WS REJECT sid={} type={} code={}: {}", id, type, e.getCode(), e.getMessage());
            replyError(id, e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("WS handler failed (sid={}, type={})", id, type, e);
            replyError(id, "internal-error", "unexpected server error");
        }
    }

    void dispatch(String id, String type, JsonNode n) {
        Optional<SignalKind> signal = SignalKind.fromInbound(type);
        if (signal.isPresent()) {
            relay.relay(id, signal.get(), required(n, "roomId"), text(n, "target"), n.get("payload"));
            return;
        }

        switch (type) {
            case "ping" -> gateway.send(id, "pong", Map.of());

            // --- 1:1 ---
            case "request-match" -> chat.requestMatch(id, ChatMode.fromWire(text(n, "mode")), text(n, "displayName"));
            case "leave-queue" -> chat.leaveQueue(id);
            case "send-message" -> chat.sendMessage(id, required(n, "roomId"), text(n, "text"));
            case "advance-segment" -> chat.advanceSegment(id, required(n, "roomId"));
            case "skip" -> chat.skip(id, required(n, "roomId"));
            case "leave-room" -> chat.leaveRoom(id, required(n, "roomId"));
            case "report" -> chat.report(id, required(n, "roomId"), strings(n, "reasons"), text(n, "details"));
            case "join-room" -> relay.join(id, required(n, "roomId"));

            // --- debates ---
            case "create-debate" -> debates.create(id, text(n, "name"), integer(n, "segmentCount"), text(n, "title"));
            case "join-debate" -> debates.join(id, required(n, "code"), text(n, "role"), text(n, "name"));
            case "start-debate" -> debates.start(id, required(n, "code"));
            case "debate-advance" -> debates.advance(id, required(n, "code"));
            case "debate-chat" -> debates.chat(id, required(n, "code"), text(n, "text"));
            case "debate-question" -> debates.submitQuestion(id, required(n, "code"), text(n, "text"));
            case "debate-qna-next" -> debates.nextQuestion(id, required(n, "code"));
            case "debate-question-answered" -> debates.markAnswered(id, required(n, "code"));
            case "leave-debate" -> debates.leave(id, required(n, "code"));

            default -> replyError(id, "bad-request", "unknown message type '" + type + "'");
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("WS transport error sid={}: {}", session.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        String id = session.getId();
        log.info("WS CLOSE sid={} code={} reason={}", id, status.getCode(), status.getReason());
        try {
            relay.forget(id);
            debates.disconnect(id);
            chat.disconnect(id);
        } catch (RuntimeException e) {
            log.error("WS cleanup failed (sid={})", id, e);
        } finally {
            gateway.unregister(id);
        }
    }

    // --- helpers ---

    private void replyError(String id, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("message", message);
        gateway.send(id, "error", body);
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }

    private static String required(JsonNode n, String field) {
        String v = text(n, field);
        if (v == null || v.isBlank()) {
            throw new ProtocolViolationException("bad-request", field + " is required");
        }
        return v.trim();
    }

    private static Integer integer(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        if (v.canConvertToInt()) return v.asInt();
        if (v.isTextual()) {
            try { return Integer.parseInt(v.asText().trim()); }
            catch (NumberFormatException e) {
                throw new ProtocolViolationException("bad-request", field + " must be a number");
            }
        }
        throw new ProtocolViolationException("bad-request", field + " must be a number");
    }

    private static List<String> strings(JsonNode n, String field) {
        List<String> out = new ArrayList<>();
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return out;
        if (v.isArray()) {
            for (JsonNode e : v) if (!e.isNull()) out.add(e.asText());
        } else {
            out.add(v.asText());
        }
        return out;
    }
}
