package org.tsticker;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsticker.commands.AccountCommand;
import org.tsticker.commands.Command;
import org.tsticker.commands.CommandHandler;
import org.tsticker.commands.Commands;
import org.tsticker.commands.LocalCommand;
import org.tsticker.commands.exceptions.CommandException;
import org.tsticker.commands.exceptions.IOErrorException;
import org.tsticker.commands.exceptions.UnexpectedErrorException;
import org.tsticker.commands.exceptions.UserErrorException;
import org.tsticker.manager.Manager;
import org.tsticker.manager.Settings;
import org.tsticker.manager.StickerAccountFiles;
import org.tsticker.manager.api.AppInitException;
import org.tsticker.manager.api.NotLoggedInException;
import org.tsticker.manager.config.ServiceConfig;
import org.tsticker.manager.encoder.PassThroughStickerEncoder;
import org.tsticker.manager.remote.RemoteClientFactory;
import org.tsticker.output.JsonWriterImpl;
import org.tsticker.output.OutputWriter;
import org.tsticker.output.PlainTextWriterImpl;
import org.tsticker.util.IOUtils;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.time.Duration;

import static net.sourceforge.argparse4j.DefaultSettings.VERSION_0_9_0_DEFAULT_SETTINGS;

public class App {

    private final static Logger logger = LoggerFactory.getLogger(App.class);

    private final Namespace ns;

    static ArgumentParser buildArgumentParser() {
        var parser = ArgumentParsers.newFor("tsticker", VERSION_0_9_0_DEFAULT_SETTINGS)
                .includeArgumentNamesAsKeysInResult(true)
                .build()
                .defaultHelp(true)
                .description("Keeps a local directory of stickers in sync with a Telegram sticker collection.")
                .version(BaseConfig.PROJECT_NAME + " " + BaseConfig.PROJECT_VERSION);

        parser.addArgument("--version").help("Show package version.").action(Arguments.version());
        parser.addArgument("-v", "--verbose")
                .help("Raise log level. Specify multiple times for even more logs.")
                .action(Arguments.count());
        parser.addArgument("--log-file")
                .type(File.class)
                .help("Write log output to the given file. If --verbose is also given, the detailed logs will only be written to the log file.");
        parser.addArgument("--scrub-log")
                .action(Arguments.storeTrue())
                .help("Scrub possibly sensitive information from the log, like bot tokens and user ids.");
        parser.addArgument("-c", "--config")
                .help("Set the path, where to store the credential (Default: $XDG_DATA_HOME/tsticker , $HOME/.local/share/tsticker).");

        parser.addArgument("-o", "--output")
                .help("Choose to output in plain text or JSON")
                .type(Arguments.enumStringType(OutputType.class));

        parser.addArgument("--max-concurrent-requests")
                .type(Integer.class)
                .setDefault(ServiceConfig.DEFAULT_MAX_CONCURRENT_REQUESTS)
                .help("Maximum number of remote requests in flight.");
        parser.addArgument("--request-interval")
                .type(Double.class)
                .setDefault(ServiceConfig.DEFAULT_REQUEST_INTERVAL.toMillis() / 1000d)
                .help("Minimum time in seconds a request slot stays occupied after each remote request.");
        parser.addArgument("--snapshot-retention")
                .type(Integer.class)
                .setDefault(ServiceConfig.DEFAULT_SNAPSHOT_RETENTION)
                .help("Number of sticker directory snapshots to keep.");

        var subparsers = parser.addSubparsers().title("subcommands").dest("command");

        Commands.getCommandSubparserAttachers().forEach((key, value) -> {
            var subparser = subparsers.addParser(key);
            value.attachToSubparser(subparser);
        });

        return parser;
    }

    public App(final Namespace ns) {
        this.ns = ns;
    }

    public void init() throws CommandException {
        logger.debug("Starting {}", BaseConfig.PROJECT_NAME + " " + BaseConfig.PROJECT_VERSION);
        var commandKey = ns.getString("command");
        var command = Commands.getCommand(commandKey);
        if (command == null) {
            throw new UserErrorException("Command not implemented!");
        }

        final var outputWriter = getOutputWriter(command);
        final var commandHandler = new CommandHandler(ns, outputWriter);

        final var accountFiles = loadAccountFiles();

        if (command instanceof AccountCommand accountCommand) {
            commandHandler.handleAccountCommand(accountCommand, accountFiles);
            return;
        }

        if (command instanceof LocalCommand localCommand) {
            handleLocalCommand(localCommand, accountFiles, commandHandler);
            return;
        }

        throw new UserErrorException("Command not implemented!");
    }

    private OutputWriter getOutputWriter(final Command command) throws UserErrorException {
        final var outputTypeInput = ns.<OutputType>get("output");
        final var outputType = outputTypeInput == null ? command.getSupportedOutputTypes()
                .stream()
                .findFirst()
                .orElse(null) : outputTypeInput;
        final var writer = new BufferedWriter(new OutputStreamWriter(System.out, IOUtils.getConsoleCharset()));
        final var outputWriter = outputType == null
                ? null
                : outputType == OutputType.JSON ? new JsonWriterImpl(writer) : new PlainTextWriterImpl(writer);

        if (outputWriter != null && !command.getSupportedOutputTypes().contains(outputType)) {
            throw new UserErrorException("Command doesn't support output type " + outputType);
        }
        return outputWriter;
    }

    Settings getSettings() throws UserErrorException {
        final var maxConcurrentRequests = ns.getInt("max-concurrent-requests");
        final var requestInterval = Duration.ofMillis(Math.round(ns.getDouble("request-interval") * 1000));
        final var snapshotRetention = ns.getInt("snapshot-retention");
        try {
            return new Settings(maxConcurrentRequests,
                    requestInterval,
                    snapshotRetention,
                    ServiceConfig.DEFAULT_READ_RETRIES);
        } catch (IllegalArgumentException e) {
            throw new UserErrorException("Invalid settings: " + e.getMessage(), e);
        }
    }

    private StickerAccountFiles loadAccountFiles() throws UserErrorException {
        final File configPath;
        final var config = ns.getString("config");
        if (config != null) {
            configPath = new File(config);
        } else {
            configPath = getDefaultConfigPath();
        }

        final var remoteClientFactory = RemoteClientFactory.load().orElse(null);
        if (remoteClientFactory == null) {
            logger.debug("No remote client implementation found on the class path");
        }
        return new StickerAccountFiles(configPath,
                getSettings(),
                remoteClientFactory,
                new PassThroughStickerEncoder());
    }

    private void handleLocalCommand(
            final LocalCommand command,
            final StickerAccountFiles accountFiles,
            final CommandHandler commandHandler
    ) throws CommandException {
        try (var m = loadManager(accountFiles)) {
            commandHandler.handleLocalCommand(command, m);
        }
    }

    private Manager loadManager(final StickerAccountFiles accountFiles) throws CommandException {
        logger.trace("Loading credential");
        try {
            return accountFiles.initManager();
        } catch (NotLoggedInException e) {
            throw new UserErrorException(e.getMessage());
        } catch (AppInitException e) {
            throw new UserErrorException(e.getMessage(), e);
        } catch (IOException e) {
            throw new IOErrorException("Error loading the stored credential: " + e.getMessage(), e);
        } catch (Throwable e) {
            throw new UnexpectedErrorException("Error creating the remote client: "
                    + e.getMessage()
                    + " ("
                    + e.getClass().getSimpleName()
                    + ")", e);
        }
    }

    /**
     * @return the default data directory to be used by tsticker.
     */
    private static File getDefaultConfigPath() {
        return new File(IOUtils.getDataHomeDir(), "tsticker");
    }
}
