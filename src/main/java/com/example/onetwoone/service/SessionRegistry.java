package com.example.onetwoone.service;

import com.example.onetwoone.error.NotFoundException;
import com.example.onetwoone.model.Connection;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Connection id → {@link Connection}. Not thread-safe; ChatService guards it with its lock. */
class SessionRegistry {

    private final Map<String, Connection> connections = new LinkedHashMap<>();

    Connection register(String connectionId) {
        return connections.computeIfAbsent(connectionId, Connection::new);
    }

    Optional<Connection> find(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(connections.get(connectionId));
    }

    Connection require(String connectionId) {
        return find(connectionId).orElseThrow(() -> new NotFoundException("connection", connectionId));
    }

    /** Returns the removed connection or null if it was not registered. */
    Connection remove(String connectionId) {
        if (connectionId == null) return null;
        return connections.remove(connectionId);
    }

    int size() {
        return connections.size();
    }
}
