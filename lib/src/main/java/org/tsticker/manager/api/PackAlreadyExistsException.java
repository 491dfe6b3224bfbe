package org.tsticker.manager.api;

import java.nio.file.Path;

public class PackAlreadyExistsException extends Exception {

    public PackAlreadyExistsException(final Path packDir) {
        super("Pack directory already exists: " + packDir);
    }
}
