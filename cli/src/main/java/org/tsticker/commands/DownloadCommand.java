package org.tsticker.commands;

import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsticker.OutputType;
import org.tsticker.commands.exceptions.CommandException;
import org.tsticker.commands.exceptions.IOErrorException;
import org.tsticker.commands.exceptions.RemoteErrorException;
import org.tsticker.commands.exceptions.UserErrorException;
import org.tsticker.manager.Manager;
import org.tsticker.manager.api.CollectionNotFoundException;
import org.tsticker.manager.api.RemoteFailureException;
import org.tsticker.output.JsonWriter;
import org.tsticker.output.OutputWriter;
import org.tsticker.output.PlainTextWriter;
import org.tsticker.util.CommandUtil;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Map;

public class DownloadCommand implements LocalCommand {

    private static final Logger logger = LoggerFactory.getLogger(DownloadCommand.class);

    @Override
    public String getName() {
        return "download";
    }

    @Override
    public List<OutputType> getSupportedOutputTypes() {
        return List.of(OutputType.PLAIN_TEXT, OutputType.JSON);
    }

    @Override
    public void attachToSubparser(final Subparser subparser) {
        subparser.help("Download all stickers of a collection, without creating a local pack.");
        subparser.addArgument("-l", "--link")
                .required(true)
                .help("Link of the collection (e.g. https://t.me/addstickers/NAME) or its name.");
        subparser.addArgument("-d", "--download-dir")
                .setDefault(".")
                .help("Existing directory in which a directory named after the collection is created.");
    }

    @Override
    public void handleCommand(
            final Namespace ns, final Manager m, final OutputWriter outputWriter
    ) throws CommandException {
        final var targetDir = CommandUtil.getDirectory(ns.getString("download-dir"));
        final var link = CommandUtil.getStickerPackLink(ns.getString("link"));

        final int count;
        try {
            count = m.downloadPack(targetDir, link);
        } catch (CollectionNotFoundException e) {
            throw new UserErrorException(e.getMessage(), e);
        } catch (NoSuchFileException e) {
            throw new UserErrorException("Download directory does not exist: " + targetDir, e);
        } catch (RemoteFailureException e) {
            logger.error("Download of {} failed: {}", link.name(), e.getMessage());
            throw new RemoteErrorException("Download failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new IOErrorException("Download failed: " + e.getMessage(), e);
        }

        final var packDir = targetDir.resolve(link.name());
        if (outputWriter instanceof JsonWriter jsonWriter) {
            jsonWriter.write(Map.of("directory", packDir.toString(), "downloaded", count));
        } else if (outputWriter instanceof PlainTextWriter writer) {
            writer.println("Downloaded {} stickers to {}", count, packDir);
        }
    }
}
