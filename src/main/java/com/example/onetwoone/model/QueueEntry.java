package com.example.onetwoone.model;

import java.time.Instant;
import java.util.Objects;

/** A connection waiting for a peer in one of the mode queues. */
public record QueueEntry(String connectionId, ChatMode requestedMode, String displayName, Instant enqueuedAt) {

    public QueueEntry {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(requestedMode, "requestedMode");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
        displayName = Connection.normalizeName(displayName);
    }
}
