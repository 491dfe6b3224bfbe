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
import org.tsticker.manager.api.InitResult;
import org.tsticker.manager.api.PackAlreadyExistsException;
import org.tsticker.manager.api.RemoteFailureException;
import org.tsticker.output.JsonWriter;
import org.tsticker.output.OutputWriter;
import org.tsticker.output.PlainTextWriter;
import org.tsticker.util.CommandUtil;
import org.tsticker.util.SyncResultUtils;
import org.tsticker.util.SyncResultUtils.JsonPullResult;

import java.io.IOException;
import java.util.List;

public class TraceCommand implements LocalCommand {

    @Override
    public String getName() {
        return "trace";
    }

    @Override
    public List<OutputType> getSupportedOutputTypes() {
        return List.of(OutputType.PLAIN_TEXT, OutputType.JSON);
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Create a local pack for an existing sticker collection and download its stickers.");
        subparser.addArgument("-l", "--link")
                .required(true)
                .help("Link of the collection (e.g. https://t.me/addstickers/NAME) or its name.");
        subparser.addArgument("--dir").setDefault(".").help("Directory in which the pack directory is created.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var parentDir = CommandUtil.getDirectory(ns.getString("dir"));
        final var link = CommandUtil.getStickerPackLink(ns.getString("link"));

        final InitResult result;
        try {
            result = m.tracePack(parentDir, link);
        } catch (CollectionNotFoundException | PackAlreadyExistsException e) {
            throw new UserErrorException(e.getMessage(), e);
        } catch (RemoteFailureException e) {
            throw new RemoteErrorException("Failed to trace " + link.name() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new IOErrorException("Failed to create pack: " + e.getMessage(), e);
        }

        final var pack = result.pack();
        if (outputWriter instanceof JsonWriter jsonWriter) {
            jsonWriter.write(new InitCommand.JsonInitResult(result.packDir().toString(),
                    pack.name(),
                    pack.title(),
                    pack.stickerType().getValue(),
                    link.getUrl().toString(),
                    true,
                    JsonPullResult.from(result.pull())));
        } else if (outputWriter instanceof PlainTextWriter writer) {
            writer.println("Tracing “{}” ({}) in {}", pack.title(), pack.name(), result.packDir());
            SyncResultUtils.printPullResult(writer, result.pull());
        }
    }
}
