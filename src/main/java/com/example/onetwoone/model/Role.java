package com.example.onetwoone.model;

import java.util.Locale;

/** Seat of a member in a 1:1 room. USER1 drives segment timing and speaks first. */
public enum Role {
    USER1,
    USER2;

    public boolean isAuthority() {
        return this == USER1;
    }

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
