package com.example.onetwoone.debate;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Debate lifecycle. Phases only ever move forward. */
public enum DebatePhase {
    LOBBY,
    DEBATE,
    QNA,
    ENDED;

    public boolean isRunning() {
        return this == DEBATE || this == QNA;
    }

    public boolean canMoveTo(DebatePhase next) {
        return next != null && next.ordinal() > ordinal();
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
