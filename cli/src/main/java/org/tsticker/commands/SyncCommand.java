package org.tsticker.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.tsticker.OutputType;
import org.tsticker.commands.exceptions.CommandException;
import org.tsticker.commands.exceptions.IOErrorException;
import org.tsticker.commands.exceptions.RemoteErrorException;
import org.tsticker.commands.exceptions.UserErrorException;
import org.tsticker.manager.Manager;
import org.tsticker.manager.api.CollectionNotFoundException;
import org.tsticker.manager.api.CorruptedIndexException;
import org.tsticker.manager.api.PackNotFoundException;
import org.tsticker.manager.api.PullResult;
import org.tsticker.manager.api.RemoteFailureException;
import org.tsticker.output.JsonWriter;
import org.tsticker.output.OutputWriter;
import org.tsticker.output.PlainTextWriter;
import org.tsticker.util.CommandUtil;
import org.tsticker.util.SyncResultUtils;
import org.tsticker.util.SyncResultUtils.JsonPullResult;

import java.io.IOException;
import java.util.List;

public class SyncCommand implements LocalCommand {

    @Override
    public String getName() {
        return "sync";
    }

    @Override
    public List<OutputType> getSupportedOutputTypes() {
        return List.of(OutputType.PLAIN_TEXT, OutputType.JSON);
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Pull the remote collection into the local pack. Local files missing remotely are removed.");
        subparser.addArgument("--dir").setDefault(".").help("Directory of the pack.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var packDir = CommandUtil.getDirectory(ns.getString("dir"));

        final PullResult result;
        try {
            result = m.sync(packDir);
        } catch (PackNotFoundException e) {
            throw new UserErrorException(e.getMessage(), e);
        } catch (CorruptedIndexException e) {
            throw new UserErrorException("Invalid index file in " + packDir + ": " + e.getMessage(), e);
        } catch (CollectionNotFoundException e) {
            throw new UserErrorException(e.getMessage() + ". Run 'push' to create it.", e);
        } catch (RemoteFailureException e) {
            throw new RemoteErrorException("Sync failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new IOErrorException("Sync failed: " + e.getMessage(), e);
        }

        if (outputWriter instanceof JsonWriter jsonWriter) {
            jsonWriter.write(JsonPullResult.from(result));
        } else if (outputWriter instanceof PlainTextWriter writer) {
            SyncResultUtils.printPullResult(writer, result);
        }
    }
}
