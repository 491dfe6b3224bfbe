package org.tsticker;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.DefaultSettings;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

import org.tsticker.commands.exceptions.CommandException;
import org.tsticker.commands.exceptions.IOErrorException;
import org.tsticker.commands.exceptions.RemoteErrorException;
import org.tsticker.commands.exceptions.UnexpectedErrorException;
import org.tsticker.commands.exceptions.UserErrorException;
import org.tsticker.logging.LogConfigurator;

import java.io.File;

public class Main {

    public static void main(String[] args) {
        // Configuring the logger needs to happen before any logger is initialized

        final var nsLog = parseArgs(args);
        final var verboseLevel = nsLog == null ? 0 : nsLog.getInt("verbose");
        final var logFile = nsLog == null ? null : nsLog.<File>get("log-file");
        final var scrubLog = nsLog != null && nsLog.getBoolean("scrub-log");
        configureLogging(verboseLevel, logFile, scrubLog);

        var parser = App.buildArgumentParser();

        var ns = parser.parseArgsOrFail(args);

        int status = 0;
        try {
            new App(ns).init();
        } catch (CommandException e) {
            System.err.println(e.getMessage());
            if (verboseLevel > 0 && e.getCause() != null) {
                e.getCause().printStackTrace();
            }
            status = getStatusForError(e);
        } catch (Throwable e) {
            e.printStackTrace();
            status = 2;
        }
        System.exit(status);
    }

    private static Namespace parseArgs(String[] args) {
        var parser = ArgumentParsers.newFor("tsticker", DefaultSettings.VERSION_0_9_0_DEFAULT_SETTINGS)
                .includeArgumentNamesAsKeysInResult(true)
                .build()
                .defaultHelp(false);
        parser.addArgument("-v", "--verbose").action(Arguments.count());
        parser.addArgument("--log-file").type(File.class);
        parser.addArgument("--scrub-log").action(Arguments.storeTrue());

        try {
            return parser.parseKnownArgs(args, null);
        } catch (ArgumentParserException e) {
            return null;
        }
    }

    private static void configureLogging(final int verboseLevel, final File logFile, final boolean scrubLog) {
        LogConfigurator.setVerboseLevel(verboseLevel);
        LogConfigurator.setLogFile(logFile);
        LogConfigurator.setScrubSensitiveInformation(scrubLog);
    }

    static int getStatusForError(final CommandException e) {
        if (e instanceof UserErrorException) {
            return 1;
        } else if (e instanceof UnexpectedErrorException) {
            return 2;
        } else if (e instanceof IOErrorException) {
            return 3;
        } else if (e instanceof RemoteErrorException) {
            return 4;
        } else {
            return 2;
        }
    }
}
