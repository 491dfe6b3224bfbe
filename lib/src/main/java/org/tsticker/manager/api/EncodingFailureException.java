package org.tsticker.manager.api;

import java.nio.file.Path;

public class EncodingFailureException extends Exception {

    private final Path file;

    public EncodingFailureException(final Path file, final String message) {
        super("Failed to create sticker from " + file.getFileName() + ": " + message);
        this.file = file;
    }

    public EncodingFailureException(final Path file, final String message, final Throwable cause) {
        super("Failed to create sticker from " + file.getFileName() + ": " + message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
