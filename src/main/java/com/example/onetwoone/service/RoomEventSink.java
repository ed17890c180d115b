package com.example.onetwoone.service;

import com.example.onetwoone.model.ChatMode;

import java.time.Instant;
import java.util.List;

/**
 * Hook for external collaborators (persistence, moderation). Implementations must be fast and must not
 * call back into the chat services. Failures are logged and never affect the room lifecycle.
 */
public interface RoomEventSink {

    enum CloseReason { LEFT, DISCONNECTED, REPORTED, DEBATE_ENDED }

    /** A 1:1 room or a debate room went away. Mode is null for debates. */
    record RoomClosed(String roomId, ChatMode mode, String closedBy, CloseReason reason,
                      Instant createdAt, Instant closedAt) { }

    record ReportFiled(String reportId, String roomId, String reporterId, String reportedId,
                       List<String> reasons, String details, Instant filedAt) { }

    void roomClosed(RoomClosed event);

    default void reportFiled(ReportFiled event) {
        // no-op by default
    }
}
