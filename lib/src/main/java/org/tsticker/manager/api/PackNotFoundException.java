package org.tsticker.manager.api;

public class PackNotFoundException extends Exception {

    public PackNotFoundException(final String message) {
        super(message);
    }
}
