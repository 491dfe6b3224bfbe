package org.tsticker.manager.api;

public class AppInitException extends Exception {

    public AppInitException(final String message) {
        super(message);
    }

    public AppInitException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
