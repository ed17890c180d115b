package com.example.onetwoone.debate;

/** A named member of a debate: debater slot holder or viewer. */
public record DebateSeat(String connectionId, String name) { }
