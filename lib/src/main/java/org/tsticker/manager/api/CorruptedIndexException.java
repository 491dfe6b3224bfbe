package org.tsticker.manager.api;

public class CorruptedIndexException extends Exception {

    public CorruptedIndexException(final String message) {
        super(message);
    }

    public CorruptedIndexException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
