package org.tsticker.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.tsticker.commands.exceptions.CommandException;
import org.tsticker.commands.exceptions.IOErrorException;
import org.tsticker.manager.StickerAccountFiles;
import org.tsticker.output.OutputWriter;
import org.tsticker.output.PlainTextWriter;

import java.io.IOException;

public class LogoutCommand implements AccountCommand {

    @Override
    public String getName() {
        return "logout";
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Delete the stored bot credential.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final StickerAccountFiles accountFiles, final OutputWriter outputWriter
    ) throws CommandException {
        final boolean deleted;
        try {
            deleted = accountFiles.logout();
        } catch (IOException e) {
            throw new IOErrorException("Failed to delete credential: " + e.getMessage(), e);
        }
        final var writer = (PlainTextWriter) outputWriter;
        writer.println(deleted ? "Logged out." : "Not logged in, nothing to do.");
    }
}
