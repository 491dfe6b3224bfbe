package org.tsticker.manager.api;

import java.util.List;

/**
 * Local descriptor of one sticker collection, as stored in the pack index.
 */
public record Pack(
        String title,
        String name,
        StickerType stickerType,
        String operatorId,
        String integrityTag,
        List<Emote> emotes
) {

    public Pack {
        emotes = List.copyOf(emotes);
    }

    public Pack withEmotes(final List<Emote> emotes) {
        return new Pack(title, name, stickerType, operatorId, integrityTag, emotes);
    }
}
