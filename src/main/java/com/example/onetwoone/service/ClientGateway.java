package com.example.onetwoone.service;

import java.util.Map;

/**
 * Outbound side of the transport. Services only know connection ids and event names;
 * the WebSocket layer turns them into JSON frames.
 */
public interface ClientGateway {

    /** Deliver one event to one connection. Unknown or closed connections are ignored. */
    void send(String connectionId, String type, Map<String, Object> fields);

    /** Deliver one event to every open connection. */
    void broadcast(String type, Map<String, Object> fields);
}
