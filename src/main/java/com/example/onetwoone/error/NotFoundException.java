package com.example.onetwoone.error;

/** Unknown room, debate or connection. */
public class NotFoundException extends ChatException {

    public NotFoundException(String what, String id) {
        super(what + "-not-found", what + " '" + id + "' not found");
    }
}
