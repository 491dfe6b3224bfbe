package org.tsticker.commands.exceptions;

import org.tsticker.manager.api.RemoteFailureException;

/**
 * The sticker service rejected a request or could not be reached.
 */
public final class RemoteErrorException extends CommandException {

    public RemoteErrorException(final String message, final RemoteFailureException cause) {
        super(message, cause);
    }
}
