package org.tsticker.manager.api;

public enum StickerFormat {
    STATIC("static"),
    ANIMATED("animated"),
    VIDEO("video");

    private final String value;

    StickerFormat(final String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
