package com.example.onetwoone.model;

import com.example.onetwoone.error.ProtocolViolationException;

import java.util.List;
import java.util.Locale;

/** Chat format a user asks for. {@link #ANY} is a wildcard that only lives in the queue, never in a room. */
public enum ChatMode {
    VIDEO,
    AUDIO,
    TEXT,
    ANY;

    /** Queues an {@link #ANY} requester searches, in priority order. */
    public static final List<ChatMode> ANY_SEARCH_ORDER = List.of(VIDEO, AUDIO, TEXT, ANY);

    public boolean isConcrete() {
        return this != ANY;
    }

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Queues searched for this requester, in order. */
    public List<ChatMode> searchOrder() {
        return isConcrete() ? List.of(this, ANY) : ANY_SEARCH_ORDER;
    }

    public boolean isCompatibleWith(ChatMode other) {
        if (other == null) return false;
        return this == ANY || other == ANY || this == other;
    }

    /**
     * Effective mode of a room built from a requester and a waiting peer.
     * The concrete side wins; two wildcards default to {@link #VIDEO}.
     */
    public static ChatMode resolve(ChatMode requested, ChatMode matched) {
        if (requested == null || matched == null) {
            throw new IllegalArgumentException("modes must not be null");
        }
        if (!requested.isCompatibleWith(matched)) {
            throw new IllegalArgumentException("incompatible modes " + requested + " / " + matched);
        }
        if (requested.isConcrete()) return requested;
        if (matched.isConcrete()) return matched;
        return VIDEO;
    }

    public static ChatMode fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ProtocolViolationException("bad-mode", "mode is required");
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "video": return VIDEO;
            case "audio": return AUDIO;
            case "text":  return TEXT;
            case "any":   return ANY;
            default:
                throw new ProtocolViolationException("bad-mode", "unknown mode '" + raw + "'");
        }
    }
}
