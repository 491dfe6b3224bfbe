package org.tsticker.commands.exceptions;

public final class UnexpectedErrorException extends CommandException {

    public UnexpectedErrorException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
