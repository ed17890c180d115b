package com.example.onetwoone.error;

/**
 * Base class for rejected client actions. Scoped to one connection or room, never fatal.
 * The code is sent back to the client in an {@code error} event.
 */
public abstract class ChatException extends RuntimeException {

    private final String code;

    protected ChatException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
