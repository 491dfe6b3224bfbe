package org.tsticker.manager.api;

public class RemoteFailureException extends Exception {

    public RemoteFailureException(final String message) {
        super(message);
    }

    public RemoteFailureException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
