package org.tsticker.manager.helper;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tsticker.manager.TestFiles;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalInventoryTest {

    @TempDir
    Path stickers;

    @Test
    void keepsLexicographicallyFirstDuplicate() throws Exception {
        TestFiles.writePng(stickers, "cat.webp", 10);
        TestFiles.writePng(stickers, "cat.png", 20);
        TestFiles.writePng(stickers, "dog.png", 30);

        final var files = new LocalInventory(stickers).scan();

        assertEquals(List.of("cat", "dog"), files.stream().map(LocalFile::contentKey).toList());
        assertEquals(20, files.get(0).byteSize());
        assertTrue(Files.exists(stickers.resolve("cat.png")));
        assertFalse(Files.exists(stickers.resolve("cat.webp")));
    }

    @Test
    void skipsHiddenFilesAndDirectories() throws Exception {
        TestFiles.writePng(stickers, ".DS_Store", 10);
        Files.createDirectories(stickers.resolve("nested"));
        TestFiles.writePng(stickers, "a.png", 10);

        final var files = new LocalInventory(stickers).scan();

        assertEquals(1, files.size());
        assertEquals(stickers.resolve("a.png"), files.get(0).path());
    }

    @Test
    void createsMissingDirectory() throws Exception {
        final var missing = stickers.resolve("stickers");

        assertEquals(List.of(), new LocalInventory(missing).scan());
        assertTrue(Files.isDirectory(missing));
    }

    @Test
    void stemOfFileWithoutExtension() {
        assertEquals("README", LocalInventory.stem(Path.of("README")));
        assertEquals("a.b", LocalInventory.stem(Path.of("a.b.png")));
    }
}
