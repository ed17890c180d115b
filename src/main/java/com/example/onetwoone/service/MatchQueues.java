package com.example.onetwoone.service;

import com.example.onetwoone.model.ChatMode;
import com.example.onetwoone.model.QueueEntry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * One FIFO per mode. Not thread-safe: {@link #claim} is a search-and-remove that ChatService runs under its
 * lock, which is what makes a waiting entry claimable by at most one requester.
 */
class MatchQueues {

    private final Map<ChatMode, Deque<QueueEntry>> queues = new EnumMap<>(ChatMode.class);

    MatchQueues() {
        for (ChatMode m : ChatMode.values()) {
            queues.put(m, new ArrayDeque<>());
        }
    }

    /**
     * Finds the oldest compatible entry following the requester's search order and removes it.
     * Entries of the requester itself are skipped.
     */
    Optional<QueueEntry> claim(String requesterId, ChatMode requested) {
        for (ChatMode m : requested.searchOrder()) {
            Iterator<QueueEntry> it = queues.get(m).iterator();
            while (it.hasNext()) {
                QueueEntry e = it.next();
                if (e.connectionId().equals(requesterId)) continue;
                if (!requested.isCompatibleWith(e.requestedMode())) continue;
                it.remove();
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /** Appends to the entry's own mode queue, replacing any older entry of the same connection. */
    void enqueue(QueueEntry entry) {
        remove(entry.connectionId());
        queues.get(entry.requestedMode()).addLast(entry);
    }

    /** Idempotent. */
    boolean remove(String connectionId) {
        if (connectionId == null) return false;
        for (Deque<QueueEntry> q : queues.values()) {
            if (q.removeIf(e -> e.connectionId().equals(connectionId))) return true;
        }
        return false;
    }

    Optional<ChatMode> modeOf(String connectionId) {
        for (Map.Entry<ChatMode, Deque<QueueEntry>> e : queues.entrySet()) {
            for (QueueEntry q : e.getValue()) {
                if (q.connectionId().equals(connectionId)) return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }

    int depth(ChatMode mode) {
        return queues.get(mode).size();
    }
}
