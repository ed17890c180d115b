package com.example.onetwoone.debate;

import com.example.onetwoone.error.ProtocolViolationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DebateRole {
    DEBATER1,
    DEBATER2,
    VIEWER;

    public boolean isDebater() {
        return this != VIEWER;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Role requested on join. {@code "debater"} means "any free slot" and maps to null.
     */
    public static DebateRole fromJoinRequest(String raw) {
        String s = (raw == null) ? "" : raw.trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "viewer":   return VIEWER;
            case "debater1": return DEBATER1;
            case "debater2": return DEBATER2;
            case "debater":  return null;
            default:
                throw new ProtocolViolationException("bad-role", "unknown debate role '" + raw + "'");
        }
    }
}
