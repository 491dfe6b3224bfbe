package org.tsticker.manager.storage.pack;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.tsticker.manager.api.CorruptedIndexException;
import org.tsticker.manager.api.Emote;
import org.tsticker.manager.api.StickerType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndexStoreTest {

    @TempDir
    Path tempDir;

    private final IndexStore indexStore = new IndexStore();

    @ParameterizedTest
    @EnumSource(StickerType.class)
    void saveAndLoadYieldEqualPack(final StickerType stickerType) throws Exception {
        final var pack = IndexStore.create("My Title", "cats_by_test_bot", stickerType, "123456")
                .withEmotes(List.of(new Emote("😺", "u1"), new Emote("❤️", "u2")));
        final var file = tempDir.resolve("index.json");

        indexStore.save(file, pack);

        assertEquals(pack, indexStore.load(file));
    }

    @Test
    void integrityTagIsHexHmac() {
        final var pack = IndexStore.create("t", "name", StickerType.REGULAR, "1");

        assertEquals(64, pack.integrityTag().length());
        assertTrue(pack.integrityTag().matches("[0-9a-f]+"));
    }

    @Test
    void writesExpectedFieldNames() throws Exception {
        final var file = tempDir.resolve("index.json");
        indexStore.save(file, IndexStore.create("t", "name", StickerType.CUSTOM_EMOJI, "1"));

        final var json = Files.readString(file);
        assertTrue(json.contains("\"sticker_type\""));
        assertTrue(json.contains("\"custom_emoji\""));
        assertTrue(json.contains("\"operator_id\""));
        assertTrue(json.contains("\"lock_ns\""));
        assertTrue(json.contains("\"emotes\""));
        assertFalse(Files.exists(tempDir.resolve("index.json.tmp")));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "\"name\" : \"name\"|\"name\" : \"other\"",
            "\"sticker_type\" : \"regular\"|\"sticker_type\" : \"mask\"",
            "\"operator_id\" : \"1\"|\"operator_id\" : \"2\""
    })
    void rejectsModifiedBoundField(final String original, final String modified) throws Exception {
        final var file = tempDir.resolve("index.json");
        indexStore.save(file, IndexStore.create("t", "name", StickerType.REGULAR, "1"));
        replace(file, original, modified);

        assertThrows(CorruptedIndexException.class, () -> indexStore.load(file));
    }

    @Test
    void rejectsModifiedLock() throws Exception {
        final var file = tempDir.resolve("index.json");
        final var pack = IndexStore.create("t", "name", StickerType.REGULAR, "1");
        indexStore.save(file, pack);

        final var tag = pack.integrityTag();
        final var flipped = (tag.charAt(0) == '0' ? "1" : "0") + tag.substring(1);
        replace(file, tag, flipped);

        assertThrows(CorruptedIndexException.class, () -> indexStore.load(file));
    }

    @Test
    void titleIsNotBound() throws Exception {
        final var file = tempDir.resolve("index.json");
        indexStore.save(file, IndexStore.create("old", "name", StickerType.REGULAR, "1"));
        replace(file, "\"old\"", "\"new\"");

        assertEquals("new", indexStore.load(file).title());
    }

    @Test
    void rejectsMalformedJson() throws Exception {
        final var file = tempDir.resolve("index.json");
        Files.writeString(file, "{ not json");

        assertThrows(CorruptedIndexException.class, () -> indexStore.load(file));
    }

    @Test
    void rejectsMissingField() throws Exception {
        final var file = tempDir.resolve("index.json");
        Files.writeString(file, "{\"title\": \"t\", \"name\": \"n\", \"sticker_type\": \"regular\"}");

        assertThrows(CorruptedIndexException.class, () -> indexStore.load(file));
    }

    @Test
    void rejectsUnknownStickerType() throws Exception {
        final var file = tempDir.resolve("index.json");
        Files.writeString(file,
                "{\"title\": \"t\", \"name\": \"n\", \"sticker_type\": \"animated\", \"operator_id\": \"1\", "
                        + "\"lock_ns\": \"00\", \"emotes\": []}");

        assertThrows(CorruptedIndexException.class, () -> indexStore.load(file));
    }

    @Test
    void ignoresUnknownProperties() throws Exception {
        final var pack = IndexStore.create("t", "n", StickerType.REGULAR, "1");
        final var file = tempDir.resolve("index.json");
        Files.writeString(file,
                "{\"title\": \"t\", \"name\": \"n\", \"sticker_type\": \"regular\", \"operator_id\": \"1\", "
                        + "\"lock_ns\": \""
                        + pack.integrityTag()
                        + "\", \"emotes\": [], \"version\": 3}");

        assertEquals(pack, indexStore.load(file));
    }

    @Test
    void missingFileIsAnIoError() {
        assertThrows(IOException.class, () -> indexStore.load(tempDir.resolve("missing.json")));
    }

    private static void replace(final Path file, final String from, final String to) throws IOException {
        final var content = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(content.contains(from), "expected " + from + " in " + content);
        Files.writeString(file, content.replace(from, to), StandardCharsets.UTF_8);
    }
}
