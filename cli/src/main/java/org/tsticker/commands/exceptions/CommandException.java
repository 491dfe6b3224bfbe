package org.tsticker.commands.exceptions;

public sealed abstract class CommandException extends Exception permits IOErrorException, RemoteErrorException, UnexpectedErrorException, UserErrorException {

    public CommandException(final String message) {
        super(message);
    }

    public CommandException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
