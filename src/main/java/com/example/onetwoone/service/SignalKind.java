package com.example.onetwoone.service;

import java.util.Optional;

/** Negotiation messages the relay forwards, inbound name to outbound name. */
public enum SignalKind {
    OFFER("relay-offer", "webrtc-offer"),
    ANSWER("relay-answer", "webrtc-answer"),
    ICE("relay-ice", "webrtc-ice-candidate");

    private final String inbound;
    private final String outbound;

    SignalKind(String inbound, String outbound) {
        this.inbound = inbound;
        this.outbound = outbound;
    }

    public String inbound() { return inbound; }
    public String outbound() { return outbound; }

    public static Optional<SignalKind> fromInbound(String type) {
        for (SignalKind k : values()) {
            if (k.inbound.equals(type)) return Optional.of(k);
        }
        return Optional.empty();
    }
}
