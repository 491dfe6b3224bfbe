package org.tsticker.manager.encoder;

import org.tsticker.manager.api.EncodingFailureException;

import java.nio.file.Path;

/**
 * Converts a local image or video file into the wire format expected by the remote service.
 */
@FunctionalInterface
public interface StickerEncoder {

    /**
     * @param scale length of the longer edge of the produced sticker
     */
    EncodedSticker encode(Path file, int scale) throws EncodingFailureException;
}
