package org.tsticker.manager.encoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsticker.manager.api.EncodingFailureException;
import org.tsticker.manager.api.StickerFormat;
import org.tsticker.manager.util.MimeUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Uploads files that are already in a format accepted by the remote service, without any conversion.
 * Everything else is rejected.
 */
public class PassThroughStickerEncoder implements StickerEncoder {

    private final static Logger logger = LoggerFactory.getLogger(PassThroughStickerEncoder.class);

    @Override
    public EncodedSticker encode(final Path file, final int scale) throws EncodingFailureException {
        final byte[] data;
        try {
            data = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new EncodingFailureException(file, e.getMessage(), e);
        }
        if (data.length == 0) {
            throw new EncodingFailureException(file, "file is empty");
        }

        final var extension = MimeUtils.detectExtension(data);
        final var format = switch (extension) {
            case MimeUtils.PNG, MimeUtils.WEBP -> StickerFormat.STATIC;
            case MimeUtils.TGS -> StickerFormat.ANIMATED;
            case MimeUtils.WEBM -> StickerFormat.VIDEO;
            default -> throw new EncodingFailureException(file,
                    "unsupported file type '" + extension + "', convert it to png, webp, tgs or webm first");
        };
        logger.debug("Using {} as {} sticker without scaling to {}", file.getFileName(), format, scale);
        return new EncodedSticker(data, format, List.of());
    }
}
