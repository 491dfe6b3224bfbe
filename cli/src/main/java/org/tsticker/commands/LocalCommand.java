package org.tsticker.commands;

import net.sourceforge.argparse4j.inf.Namespace;

import org.tsticker.commands.exceptions.CommandException;
import org.tsticker.manager.Manager;
import org.tsticker.output.OutputWriter;

/**
 * Command that needs an authenticated {@link Manager}.
 */
public interface LocalCommand extends CliCommand {

    void handleCommand(Namespace ns, Manager m, OutputWriter outputWriter) throws CommandException;
}
