package org.tsticker.manager.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StickerPackLinkTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "https://t.me/addstickers/cats_by_bot",
            "https://t.me/addstickers/cats_by_bot/",
            "t.me/addstickers/cats_by_bot",
            "cats_by_bot"
    })
    void extractsCollectionName(final String link) throws Exception {
        assertEquals("cats_by_bot", StickerPackLink.fromLink(link).name());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "https://t.me/addstickers/bad-name", "https://t.me/"})
    void rejectsInvalidLinks(final String link) {
        assertThrows(StickerPackLink.InvalidStickerPackLinkException.class, () -> StickerPackLink.fromLink(link));
    }

    @Test
    void buildsShareUrl() {
        assertEquals("https://t.me/addstickers/cats_by_bot", new StickerPackLink("cats_by_bot").getUrl().toString());
    }
}
