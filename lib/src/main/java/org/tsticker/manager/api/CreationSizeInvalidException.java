package org.tsticker.manager.api;

public class CreationSizeInvalidException extends Exception {

    private final int size;

    public CreationSizeInvalidException(final String message, final int size) {
        super(message);
        this.size = size;
    }

    public int getSize() {
        return size;
    }
}
