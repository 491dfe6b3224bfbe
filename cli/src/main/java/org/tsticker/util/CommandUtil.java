package org.tsticker.util;

import org.tsticker.commands.exceptions.UserErrorException;
import org.tsticker.manager.api.StickerPackLink;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

public class CommandUtil {

    private CommandUtil() {
    }

    public static Path getDirectory(final String directory) throws UserErrorException {
        try {
            return Path.of(directory).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new UserErrorException("Invalid directory: " + directory, e);
        }
    }

    public static StickerPackLink getStickerPackLink(final String link) throws UserErrorException {
        try {
            return StickerPackLink.fromLink(link);
        } catch (StickerPackLink.InvalidStickerPackLinkException e) {
            throw new UserErrorException("Invalid sticker pack link: " + e.getMessage(), e);
        }
    }
}
