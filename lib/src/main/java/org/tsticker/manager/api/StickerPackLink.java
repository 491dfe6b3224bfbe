package org.tsticker.manager.api;

import java.net.URI;
import java.net.URISyntaxException;

public record StickerPackLink(String name) {

    private static final String ADD_STICKERS_PATH = "/addstickers/";

    /**
     * Accepts a full share link (https://t.me/addstickers/NAME) or a bare collection name.
     *
     * @throws InvalidStickerPackLinkException If the link cannot be parsed.
     */
    public static StickerPackLink fromLink(final String link) throws InvalidStickerPackLinkException {
        if (link == null || link.isBlank()) {
            throw new InvalidStickerPackLinkException("Empty sticker pack link");
        }
        var trimmed = link.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        final String name;
        if (trimmed.contains("/")) {
            final URI uri;
            try {
                uri = new URI(trimmed);
            } catch (URISyntaxException e) {
                throw new InvalidStickerPackLinkException("Invalid sticker pack link", e);
            }
            final var path = uri.getPath();
            if (path == null || path.isEmpty()) {
                throw new InvalidStickerPackLinkException("Sticker pack link has no path");
            }
            name = path.substring(path.lastIndexOf('/') + 1);
        } else {
            name = trimmed;
        }
        if (!PackNames.isValidName(name)) {
            throw new InvalidStickerPackLinkException("Invalid sticker pack name in link: " + name);
        }
        return new StickerPackLink(name);
    }

    public URI getUrl() {
        return URI.create("https://t.me" + ADD_STICKERS_PATH + name);
    }

    public final static class InvalidStickerPackLinkException extends Exception {

        public InvalidStickerPackLinkException(String message) {
            super(message);
        }

        public InvalidStickerPackLinkException(final String message, final Throwable cause) {
            super(message, cause);
        }
    }
}
