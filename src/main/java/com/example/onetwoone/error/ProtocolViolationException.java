package com.example.onetwoone.error;

/** Action requested outside its valid state. Nothing has been mutated when this is thrown. */
public class ProtocolViolationException extends ChatException {

    public ProtocolViolationException(String code, String message) {
        super(code, message);
    }
}
