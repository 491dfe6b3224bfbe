package org.tsticker.commands;

import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.tsticker.OutputType;
import org.tsticker.commands.exceptions.CommandException;
import org.tsticker.commands.exceptions.IOErrorException;
import org.tsticker.commands.exceptions.RemoteErrorException;
import org.tsticker.commands.exceptions.UserErrorException;
import org.tsticker.manager.Manager;
import org.tsticker.manager.api.InitResult;
import org.tsticker.manager.api.InvalidPackException;
import org.tsticker.manager.api.PackAlreadyExistsException;
import org.tsticker.manager.api.RemoteFailureException;
import org.tsticker.manager.api.StickerPackLink;
import org.tsticker.manager.api.StickerType;
import org.tsticker.output.JsonWriter;
import org.tsticker.output.OutputWriter;
import org.tsticker.output.PlainTextWriter;
import org.tsticker.util.CommandUtil;
import org.tsticker.util.SyncResultUtils;
import org.tsticker.util.SyncResultUtils.JsonPullResult;

import java.io.IOException;
import java.util.List;

public class InitCommand implements LocalCommand {

    @Override
    public String getName() {
        return "init";
    }

    @Override
    public List<OutputType> getSupportedOutputTypes() {
        return List.of(OutputType.PLAIN_TEXT, OutputType.JSON);
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Create a new local sticker pack. Stickers of an existing collection with the same name are pulled.");
        subparser.addArgument("-n", "--pack-name")
                .required(true)
                .help("Name of the pack, only letters, digits and underscores. The bot username is appended.");
        subparser.addArgument("-t", "--pack-title").required(true).help("Title of the pack, at most 64 characters.");
        subparser.addArgument("-s", "--sticker-type")
                .type(Arguments.enumStringType(StickerType.class))
                .setDefault(StickerType.REGULAR)
                .help("Type of the stickers.");
        subparser.addArgument("--dir").setDefault(".").help("Directory in which the pack directory is created.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var parentDir = CommandUtil.getDirectory(ns.getString("dir"));
        final var name = ns.getString("pack-name");
        final var title = ns.getString("pack-title");
        final var stickerType = ns.<StickerType>get("sticker-type");

        final InitResult result;
        try {
            result = m.initPack(parentDir, name, title, stickerType);
        } catch (InvalidPackException | PackAlreadyExistsException e) {
            throw new UserErrorException(e.getMessage(), e);
        } catch (RemoteFailureException e) {
            throw new RemoteErrorException("Failed to look up the collection: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new IOErrorException("Failed to create pack: " + e.getMessage(), e);
        }

        final var pack = result.pack();
        final var link = new StickerPackLink(pack.name()).getUrl().toString();
        if (outputWriter instanceof JsonWriter jsonWriter) {
            jsonWriter.write(new JsonInitResult(result.packDir().toString(),
                    pack.name(),
                    pack.title(),
                    pack.stickerType().getValue(),
                    link,
                    result.remoteExists(),
                    JsonPullResult.from(result.pull())));
        } else if (outputWriter instanceof PlainTextWriter writer) {
            writer.println("Created pack {} in {}", pack.name(), result.packDir());
            if (result.remoteExists()) {
                writer.println("The collection already exists: {}", link);
                SyncResultUtils.printPullResult(writer, result.pull());
            }
            writer.println("Put your stickers in {}, then run 'push' in the pack directory.",
                    result.packDir().resolve("stickers"));
        }
    }

    record JsonInitResult(
            String packDir,
            String name,
            String title,
            String stickerType,
            String link,
            boolean remoteExists,
            JsonPullResult pull
    ) {}
}
