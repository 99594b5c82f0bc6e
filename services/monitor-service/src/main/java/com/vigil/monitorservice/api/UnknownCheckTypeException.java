package com.vigil.monitorservice.api;

/**
 * Raised when a catalogue lookup names a check type that is not registered.
 */
public class UnknownCheckTypeException extends RuntimeException {

    public UnknownCheckTypeException(String type) {
        super("Unknown check type: " + type);
    }
}
