package com.example.onetwoone.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Notifications collected during one state change and delivered before the owning service releases its lock,
 * so every connection sees events in the order the state changed. Sockets buffer, so delivery never blocks long.
 */
final class Outbox {

    private static final Logger log = LoggerFactory.getLogger(Outbox.class);

    /** target == null means every connection. */
    private record Notice(String target, String type, Map<String, Object> fields) { }

    private final List<Notice> notices = new ArrayList<>();

    Outbox to(String connectionId, String type, Map<String, Object> fields) {
        if (connectionId != null) notices.add(new Notice(connectionId, type, fields));
        return this;
    }

    Outbox toAll(String type, Map<String, Object> fields) {
        notices.add(new Notice(null, type, fields));
        return this;
    }

    void flush(ClientGateway gateway) {
        for (Notice n : notices) {
            try {
                if (n.target() == null) gateway.broadcast(n.type(), n.fields());
                else gateway.send(n.target(), n.type(), n.fields());
            } catch (RuntimeException e) {
                log.warn("Delivery of {} to {} failed: {}", n.type(), n.target() == null ? "*" : n.target(), e.toString());
            }
        }
        notices.clear();
    }

    /** Ordered field map from alternating key/value pairs; null values are kept. */
    static Map<String, Object> fields(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("fields() needs key/value pairs");
        }
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(m);
    }
}
