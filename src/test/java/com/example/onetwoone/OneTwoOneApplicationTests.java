package com.example.onetwoone;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the whole application on a random port and talks to it over real WebSockets.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class OneTwoOneApplicationTests {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @LocalServerPort
    private int port;

    private final List<WebSocketSession> open = new ArrayList<>();

    @AfterEach
    void closeAll() throws Exception {
        for (WebSocketSession s : open) if (s.isOpen()) s.close();
    }

    /** Collects every frame as parsed JSON. */
    private static final class Inbox extends TextWebSocketHandler {
        final BlockingQueue<JsonNode> frames = new LinkedBlockingQueue<>();

        @Override
        protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) throws Exception {
            frames.add(MAPPER.readTree(message.getPayload()));
        }

        JsonNode next(String type) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 5_000;
            while (System.currentTimeMillis() < deadline) {
                JsonNode n = frames.poll(deadline - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
                if (n != null && type.equals(n.path("type").asText())) return n;
            }
            throw new AssertionError("no '" + type + "' frame within 5s");
        }
    }

    private WebSocketSession connect(Inbox inbox) throws Exception {
        WebSocketSession s = new StandardWebSocketClient()
                .execute(inbox, "ws://localhost:" + port + "/chat")
                .get(5, TimeUnit.SECONDS);
        open.add(s);
        return s;
    }

    @Test
    @DisplayName("video waiter and wildcard requester are paired in a video room")
    void pairsOverWebSocket() throws Exception {
        Inbox a = new Inbox();
        Inbox b = new Inbox();
        WebSocketSession sa = connect(a);
        WebSocketSession sb = connect(b);
        String idA = a.next("connected").path("connectionId").asText();
        String idB = b.next("connected").path("connectionId").asText();

        sa.sendMessage(new TextMessage("{\"type\":\"request-match\",\"mode\":\"video\",\"displayName\":\"Alice\"}"));
        assertEquals("video", a.next("queue-joined").path("mode").asText());

        sb.sendMessage(new TextMessage("{\"type\":\"request-match\",\"mode\":\"any\",\"displayName\":\"Bob\"}"));
        JsonNode toA = a.next("match-found");
        JsonNode toB = b.next("match-found");

        assertEquals("video", toA.path("resolvedMode").asText());
        assertEquals(idB, toA.path("peerId").asText());
        assertEquals(idA, toB.path("peerId").asText());
        assertEquals(toA.path("roomId").asText(), toB.path("roomId").asText());
        assertEquals(0, toA.path("segment").asInt());
        assertEquals(1, toA.path("round").asInt());

        sb.sendMessage(new TextMessage("{\"type\":\"leave-room\",\"roomId\":\"" + toB.path("roomId").asText() + "\"}"));
        assertEquals(toA.path("roomId").asText(), a.next("peer-left").path("roomId").asText());
    }

    @Test
    void unknownFrameGetsAnErrorAndTheSocketStaysOpen() throws Exception {
        Inbox a = new Inbox();
        WebSocketSession sa = connect(a);
        a.next("connected");

        sa.sendMessage(new TextMessage("{\"type\":\"teleport\"}"));

        assertEquals("bad-request", a.next("error").path("code").asText());
        assertTrue(sa.isOpen());
    }
}
