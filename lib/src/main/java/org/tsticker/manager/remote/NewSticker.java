package org.tsticker.manager.remote;

import org.tsticker.manager.api.StickerFormat;

import java.util.List;

/**
 * Upload payload for one sticker.
 */
public record NewSticker(String sourceName, byte[] data, StickerFormat format, List<String> emojis) {

    public NewSticker {
        emojis = List.copyOf(emojis);
    }
}
