package org.tsticker.manager.api;

public class InvalidPackException extends Exception {

    public InvalidPackException(final String message) {
        super(message);
    }
}
