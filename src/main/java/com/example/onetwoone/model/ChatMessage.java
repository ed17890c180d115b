package com.example.onetwoone.model;

import com.example.onetwoone.error.ProtocolViolationException;

import java.util.UUID;

/** Chat text scoped to a room. Relayed, never persisted by the core. */
public record ChatMessage(String id, String senderId, String senderName, String text, long ts) {

    public static final int MAX_TEXT_LENGTH = 2000;

    public static ChatMessage of(String senderId, String senderName, String rawText, long ts) {
        return new ChatMessage(UUID.randomUUID().toString(), senderId, senderName, cleanText(rawText), ts);
    }

    /** Trims and bounds user text; blank text is rejected. */
    public static String cleanText(String raw) {
        String t = (raw == null) ? "" : raw.trim();
        if (t.isEmpty()) {
            throw new ProtocolViolationException("empty-text", "text must not be blank");
        }
        return t.length() > MAX_TEXT_LENGTH ? t.substring(0, MAX_TEXT_LENGTH) : t;
    }
}
