package org.tsticker.manager.encoder;

import org.tsticker.manager.api.StickerFormat;

import java.util.List;

public record EncodedSticker(byte[] data, StickerFormat format, List<String> emojiHints) {

    public EncodedSticker {
        emojiHints = List.copyOf(emojiHints);
    }
}
