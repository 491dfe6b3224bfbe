package org.tsticker.manager.api;

public class InvalidCredentialException extends Exception {

    public InvalidCredentialException(final String message) {
        super(message);
    }
}
