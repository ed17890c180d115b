package com.example.onetwoone.handler;

import com.example.onetwoone.error.ProtocolViolationException;
import com.example.onetwoone.model.ChatMode;
import com.example.onetwoone.service.ChatService;
import com.example.onetwoone.service.DebateService;
import com.example.onetwoone.service.SignalKind;
import com.example.onetwoone.service.SignalingRelay;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ChatWebSocketHandlerTest {

    private ChatService chat;
    private DebateService debates;
    private SignalingRelay relay;
    private WebSocketGateway gateway;
    private ChatWebSocketHandler handler;
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        chat = mock(ChatService.class);
        debates = mock(DebateService.class);
        relay = mock(SignalingRelay.class);
        gateway = mock(WebSocketGateway.class);
        handler = new ChatWebSocketHandler(chat, debates, relay, gateway, new ObjectMapper());
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
    }

    private void receive(String json) {
        handler.handleTextMessage(session, new TextMessage(json));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> lastError() {
        ArgumentCaptor<Map<String, Object>> body = ArgumentCaptor.forClass(Map.class);
        verify(gateway).send(eq("s1"), eq("error"), body.capture());
        return body.getValue();
    }

    @Test
    void openRegistersAndAnnouncesConnection() {
        handler.afterConnectionEstablished(session);

        verify(gateway).register(session);
        verify(chat).connect("s1");
    }

    @Test
    void requestMatchIsDispatched() {
        receive("{\"type\":\"request-match\",\"mode\":\"any\",\"displayName\":\"Bob\"}");

        verify(chat).requestMatch("s1", ChatMode.ANY, "Bob");
    }

    @Test
    void relayPassesPayloadThroughUntouched() {
        receive("{\"type\":\"relay-offer\",\"roomId\":\"room_1\",\"target\":\"s2\",\"payload\":{\"sdp\":\"v=0\"}}");

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(relay).relay(eq("s1"), eq(SignalKind.OFFER), eq("room_1"), eq("s2"), payload.capture());
        assertEquals("v=0", ((JsonNode) payload.getValue()).get("sdp").asText());
    }

    @Test
    void reportCarriesReasons() {
        receive("{\"type\":\"report\",\"roomId\":\"room_1\",\"reasons\":[\"spam\",\"abuse\"],\"details\":\"x\"}");

        verify(chat).report("s1", "room_1", List.of("spam", "abuse"), "x");
    }

    @Test
    void createDebateParsesSegmentCount() {
        receive("{\"type\":\"create-debate\",\"name\":\"Ann\",\"segmentCount\":\"4\",\"title\":\"T\"}");

        verify(debates).create("s1", "Ann", 4, "T");
    }

    @Test
    void serviceRejectionBecomesErrorFrame() {
        doThrow(new ProtocolViolationException("not-authority", "only user1 drives segment timing"))
                .when(chat).advanceSegment("s1", "room_1");

        receive("{\"type\":\"advance-segment\",\"roomId\":\"room_1\"}");

        Map<String, Object> err = lastError();
        assertEquals("not-authority", err.get("code"));
        assertEquals("only user1 drives segment timing", err.get("message"));
    }

    @Test
    void missingRoomIdIsABadRequest() {
        receive("{\"type\":\"leave-room\"}");

        assertEquals("bad-request", lastError().get("code"));
        verifyNoInteractions(chat);
    }

    @Test
    void malformedJsonIsABadRequest() {
        receive("{not json");

        assertEquals("bad-request", lastError().get("code"));
    }

    @Test
    void unknownTypeIsABadRequest() {
        receive("{\"type\":\"teleport\"}");

        assertEquals("bad-request", lastError().get("code"));
    }

    @Test
    void unexpectedFailureKeepsSocketOpen() throws Exception {
        doThrow(new IllegalStateException("boom")).when(chat).leaveQueue("s1");

        receive("{\"type\":\"leave-queue\"}");

        assertEquals("internal-error", lastError().get("code"));
        verify(session, never()).close(any());
    }

    @Test
    void pingIsAnswered() {
        receive("ping");
        receive("{\"type\":\"ping\"}");

        verify(gateway, times(2)).send(eq("s1"), eq("pong"), anyMap());
    }

    @Test
    void closeReleasesEverythingInOrder() {
        handler.afterConnectionClosed(session, CloseStatus.GOING_AWAY);

        InOrder order = inOrder(relay, debates, chat, gateway);
        order.verify(relay).forget("s1");
        order.verify(debates).disconnect("s1");
        order.verify(chat).disconnect("s1");
        order.verify(gateway).unregister("s1");
    }

    @Test
    void failedCleanupStillUnregisters() {
        doThrow(new IllegalStateException("boom")).when(debates).disconnect("s1");

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        verify(gateway).unregister("s1");
    }
}
