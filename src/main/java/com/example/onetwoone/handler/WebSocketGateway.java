package com.example.onetwoone.handler;

import com.example.onetwoone.service.ClientGateway;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connection id to open WebSocket session. Frames are JSON objects with {@code type} first.
 * Sessions are wrapped so concurrent sends from timers and request threads serialize safely.
 */
@Component
public class WebSocketGateway implements ClientGateway {

    private static final Logger log = LoggerFactory.getLogger(WebSocketGateway.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper mapper;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public WebSocketGateway(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void register(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
    }

    public void unregister(String connectionId) {
        sessions.remove(connectionId);
    }

    public int openSessions() {
        return sessions.size();
    }

    @Override
    public void send(String connectionId, String type, Map<String, Object> fields) {
        WebSocketSession s = sessions.get(connectionId);
        if (s == null) return;
        String json = toJson(type, fields);
        if (json != null) deliver(s, json);
    }

    @Override
    public void broadcast(String type, Map<String, Object> fields) {
        String json = toJson(type, fields);
        if (json == null) return;
        for (WebSocketSession s : sessions.values()) deliver(s, json);
    }

    String toJson(String type, Map<String, Object> fields) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", type);
        if (fields != null) frame.putAll(fields);
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {} frame", type, e);
            return null;
        }
    }

    private void deliver(WebSocketSession s, String json) {
        if (!s.isOpen()) return;
        try {
            s.sendMessage(new TextMessage(json));
        } catch (IOException | RuntimeException e) {
            log.warn("WS send failed (sid={}): {}", s.getId(), e.toString());
        }
    }
}
