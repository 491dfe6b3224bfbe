package org.tsticker.manager.api;

import org.tsticker.manager.config.ServiceConfig;

import java.util.Arrays;

public enum StickerType {
    MASK("mask"),
    REGULAR("regular"),
    CUSTOM_EMOJI("custom_emoji");

    private final String value;

    StickerType(final String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Edge length the encoder should scale stickers of this type to.
     */
    public int getScale() {
        return this == CUSTOM_EMOJI ? ServiceConfig.CUSTOM_EMOJI_SCALE : ServiceConfig.STICKER_SCALE;
    }

    public static StickerType fromValue(final String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown sticker type: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
