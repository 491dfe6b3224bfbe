package org.tsticker.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.tsticker.OutputType;
import org.tsticker.commands.exceptions.CommandException;
import org.tsticker.commands.exceptions.IOErrorException;
import org.tsticker.commands.exceptions.RemoteErrorException;
import org.tsticker.commands.exceptions.UserErrorException;
import org.tsticker.manager.Manager;
import org.tsticker.manager.api.CapacityExceededException;
import org.tsticker.manager.api.CorruptedIndexException;
import org.tsticker.manager.api.CreationSizeInvalidException;
import org.tsticker.manager.api.EncodingFailureException;
import org.tsticker.manager.api.PackNotFoundException;
import org.tsticker.manager.api.PushResult;
import org.tsticker.manager.api.RemoteFailureException;
import org.tsticker.output.JsonWriter;
import org.tsticker.output.OutputWriter;
import org.tsticker.output.PlainTextWriter;
import org.tsticker.util.CommandUtil;
import org.tsticker.util.SyncResultUtils;
import org.tsticker.util.SyncResultUtils.JsonPushResult;

import java.io.IOException;
import java.util.List;

public class PushCommand implements LocalCommand {

    @Override
    public String getName() {
        return "push";
    }

    @Override
    public List<OutputType> getSupportedOutputTypes() {
        return List.of(OutputType.PLAIN_TEXT, OutputType.JSON);
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Upload new local stickers, delete stickers removed locally and create the collection if needed.");
        subparser.addArgument("--dir").setDefault(".").help("Directory of the pack.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var packDir = CommandUtil.getDirectory(ns.getString("dir"));

        final PushResult result;
        try {
            result = m.push(packDir);
        } catch (PackNotFoundException | CapacityExceededException | CreationSizeInvalidException e) {
            throw new UserErrorException(e.getMessage(), e);
        } catch (CorruptedIndexException e) {
            throw new UserErrorException("Invalid index file in " + packDir + ": " + e.getMessage(), e);
        } catch (EncodingFailureException e) {
            throw new UserErrorException(e.getMessage() + ". Nothing was uploaded.", e);
        } catch (RemoteFailureException e) {
            throw new RemoteErrorException("Push failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new IOErrorException("Push failed: " + e.getMessage(), e);
        }

        if (outputWriter instanceof JsonWriter jsonWriter) {
            jsonWriter.write(JsonPushResult.from(result));
        } else if (outputWriter instanceof PlainTextWriter writer) {
            SyncResultUtils.printPushResult(writer, result);
        }

        if (!result.isComplete()) {
            throw new UserErrorException("Push incomplete: "
                    + result.failures().size()
                    + " operations failed"
                    + (result.repairsAborted() ? ", repairs aborted" : ""));
        }
    }
}
