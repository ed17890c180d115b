package com.example.onetwoone.debate;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Who holds the floor. Even segments belong to debater1, odd ones to debater2; Q&A opens both mics. */
public enum Speaker {
    DEBATER1,
    DEBATER2,
    BOTH;

    public static Speaker forSegment(int segment) {
        if (segment < 0) throw new IllegalArgumentException("segment must not be negative: " + segment);
        return (segment % 2 == 0) ? DEBATER1 : DEBATER2;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
