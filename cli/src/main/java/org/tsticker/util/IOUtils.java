package org.tsticker.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.charset.Charset;

public class IOUtils {

    private final static Logger logger = LoggerFactory.getLogger(IOUtils.class);

    private IOUtils() {
    }

    public static Charset getConsoleCharset() {
        final var console = System.console();
        return console == null ? Charset.defaultCharset() : console.charset();
    }

    public static File getDataHomeDir() {
        var dataHome = System.getenv("XDG_DATA_HOME");
        if (dataHome != null) {
            return new File(dataHome);
        }

        logger.debug("XDG_DATA_HOME not set, falling back to home dir");
        return new File(new File(System.getProperty("user.home"), ".local"), "share");
    }
}
