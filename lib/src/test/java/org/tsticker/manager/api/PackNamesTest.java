package org.tsticker.manager.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PackNamesTest {

    @ParameterizedTest
    @ValueSource(strings = {"cats", "Cats_2024", "_"})
    void acceptsValidNames(final String name) {
        assertTrue(PackNames.isValidName(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "cats-dogs", "cats dogs", "猫"})
    void rejectsInvalidNames(final String name) {
        assertFalse(PackNames.isValidName(name));
        assertThrows(InvalidPackException.class, () -> PackNames.validateName(name));
    }

    @Test
    void titleLengthIsLimited() {
        assertDoesNotThrow(() -> PackNames.validateTitle("x".repeat(64)));
        assertThrows(InvalidPackException.class, () -> PackNames.validateTitle("x".repeat(65)));
        assertThrows(InvalidPackException.class, () -> PackNames.validateTitle(""));
    }

    @Test
    void collectionNameCarriesBotSuffix() {
        assertEquals("cats_by_my_bot", PackNames.toCollectionName("cats", "my_bot"));
        assertEquals("cats_by_old_bot", PackNames.toCollectionName("cats_by_old_bot", "my_bot"));
    }

    @Test
    void stickerTypeValues() {
        assertEquals(StickerType.CUSTOM_EMOJI, StickerType.fromValue("custom_emoji"));
        assertEquals(100, StickerType.CUSTOM_EMOJI.getScale());
        assertEquals(512, StickerType.MASK.getScale());
        assertThrows(IllegalArgumentException.class, () -> StickerType.fromValue("video"));
    }
}
