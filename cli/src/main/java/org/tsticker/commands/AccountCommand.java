package org.tsticker.commands;

import net.sourceforge.argparse4j.inf.Namespace;

import org.tsticker.commands.exceptions.CommandException;
import org.tsticker.manager.StickerAccountFiles;
import org.tsticker.output.OutputWriter;

/**
 * Command that works on the stored credential itself, so it runs without being logged in.
 */
public interface AccountCommand extends CliCommand {

    void handleCommand(
            Namespace ns, StickerAccountFiles accountFiles, OutputWriter outputWriter
    ) throws CommandException;
}
