package com.example.onetwoone.model;

import java.time.Instant;

/** Immutable read view of a {@link ChatRoom}. */
public record RoomSnapshot(String roomId,
                           ChatMode mode,
                           String user1,
                           String user2,
                           int segment,
                           int round,
                           Instant segmentStartedAt,
                           long remainingSeconds) {
}
