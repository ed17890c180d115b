package com.example.onetwoone.service;

import com.example.onetwoone.error.ProtocolViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SignalingRelayTest {

    private ChatService chat;
    private DebateService debates;
    private RecordingGateway gateway;
    private SignalingRelay relay;

    @BeforeEach
    void setUp() {
        chat = mock(ChatService.class);
        debates = mock(DebateService.class);
        gateway = new RecordingGateway();
        relay = new SignalingRelay(chat, debates, gateway);

        when(chat.members("room_1")).thenReturn(List.of("a", "b"));
        when(chat.members("DEBATE01")).thenReturn(List.of());
        when(debates.members("DEBATE01")).thenReturn(List.of("d1", "d2", "v1"));
    }

    @Test
    void explicitTargetGetsOnlyThatSignal() {
        Map<String, String> sdp = Map.of("sdp", "v=0");

        List<String> to = relay.relay("a", SignalKind.OFFER, "room_1", "b", sdp);

        assertEquals(List.of("b"), to);
        RecordingGateway.Sent sent = gateway.last("b", "webrtc-offer");
        assertEquals("a", sent.fields().get("fromId"));
        assertEquals("room_1", sent.fields().get("roomId"));
        assertSame(sdp, sent.fields().get("payload"));
        assertTrue(gateway.to("a", "webrtc-offer").isEmpty());
    }

    @Test
    void withoutTargetOnlyJoinedMembersReceive() {
        relay.join("d1", "DEBATE01");
        relay.join("v1", "DEBATE01");

        List<String> to = relay.relay("d1", SignalKind.ICE, "DEBATE01", null, "cand");

        assertEquals(List.of("v1"), to);
        assertEquals(1, gateway.to("v1", "webrtc-ice-candidate").size());
        assertTrue(gateway.to("d2", "webrtc-ice-candidate").isEmpty());
    }

    @Test
    void targetOutsideTheRoomIsRejected() {
        ProtocolViolationException e = assertThrows(ProtocolViolationException.class,
                () -> relay.relay("a", SignalKind.ANSWER, "room_1", "stranger", "x"));
        assertEquals("bad-target", e.getCode());
        assertTrue(gateway.sent.isEmpty());
    }

    @Test
    void nonMembersCannotJoinOrRelay() {
        assertThrows(ProtocolViolationException.class, () -> relay.join("c", "room_1"));
        assertThrows(ProtocolViolationException.class,
                () -> relay.relay("c", SignalKind.OFFER, "room_1", "a", "x"));
    }

    @Test
    void memberWhoLeftTheRoomStopsReceiving() {
        relay.join("a", "room_1");
        relay.join("b", "room_1");
        when(chat.members("room_1")).thenReturn(List.of("a", "b"), List.of());

        assertEquals(List.of("b"), relay.relay("a", SignalKind.OFFER, "room_1", null, "x"));
        assertThrows(ProtocolViolationException.class,
                () -> relay.relay("a", SignalKind.OFFER, "room_1", null, "x"));
    }

    @Test
    void forgetDropsConnectionEverywhere() {
        relay.join("a", "room_1");
        relay.join("b", "room_1");

        relay.forget("b");

        assertEquals(java.util.Set.of("a"), relay.joinedMembers("room_1"));
        assertTrue(relay.relay("a", SignalKind.OFFER, "room_1", null, "x").isEmpty());
    }

    @Test
    void closedRoomLosesItsSignalingMembers() {
        relay.join("a", "room_1");
        relay.join("b", "room_1");
        when(chat.members("room_1")).thenReturn(List.of());

        assertThrows(ProtocolViolationException.class,
                () -> relay.relay("a", SignalKind.OFFER, "room_1", null, "x"));
        assertTrue(relay.joinedMembers("room_1").isEmpty());
    }

    @Test
    void inboundNamesMapToOutbound() {
        assertEquals(SignalKind.ICE, SignalKind.fromInbound("relay-ice").orElseThrow());
        assertEquals("webrtc-answer", SignalKind.ANSWER.outbound());
        assertTrue(SignalKind.fromInbound("relay-video").isEmpty());
    }
}
