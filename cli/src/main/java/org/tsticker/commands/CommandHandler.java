package org.tsticker.commands;

import net.sourceforge.argparse4j.inf.Namespace;

import org.tsticker.commands.exceptions.CommandException;
import org.tsticker.manager.Manager;
import org.tsticker.manager.StickerAccountFiles;
import org.tsticker.output.OutputWriter;

public class CommandHandler {

    final Namespace ns;
    final OutputWriter outputWriter;

    public CommandHandler(final Namespace ns, final OutputWriter outputWriter) {
        this.ns = ns;
        this.outputWriter = outputWriter;
    }

    public void handleAccountCommand(
            final AccountCommand command, final StickerAccountFiles accountFiles
    ) throws CommandException {
        command.handleCommand(ns, accountFiles, outputWriter);
    }

    public void handleLocalCommand(final LocalCommand command, final Manager manager) throws CommandException {
        command.handleCommand(ns, manager, outputWriter);
    }
}
