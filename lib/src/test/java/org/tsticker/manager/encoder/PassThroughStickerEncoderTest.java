package org.tsticker.manager.encoder;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tsticker.manager.TestFiles;
import org.tsticker.manager.api.EncodingFailureException;
import org.tsticker.manager.api.StickerFormat;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PassThroughStickerEncoderTest {

    @TempDir
    Path tempDir;

    private final PassThroughStickerEncoder encoder = new PassThroughStickerEncoder();

    @Test
    void pngIsStatic() throws Exception {
        final var file = TestFiles.writePng(tempDir, "a.png", 64);

        final var sticker = encoder.encode(file, 512);

        assertEquals(StickerFormat.STATIC, sticker.format());
        assertEquals(64, sticker.data().length);
        assertTrue(sticker.emojiHints().isEmpty());
    }

    @Test
    void gzipIsAnimated() throws Exception {
        final var file = Files.write(tempDir.resolve("a.tgs"), new byte[]{0x1f, (byte) 0x8b, 0x08, 0x00});

        assertEquals(StickerFormat.ANIMATED, encoder.encode(file, 512).format());
    }

    @Test
    void webmIsVideo() throws Exception {
        final var file = Files.write(tempDir.resolve("a.webm"), new byte[]{0x1a, 0x45, (byte) 0xdf, (byte) 0xa3});

        assertEquals(StickerFormat.VIDEO, encoder.encode(file, 100).format());
    }

    @Test
    void rejectsUnsupportedFormats() throws Exception {
        final var file = Files.write(tempDir.resolve("photo.jpg"), new byte[]{(byte) 0xff, (byte) 0xd8, (byte) 0xff});

        final var e = assertThrows(EncodingFailureException.class, () -> encoder.encode(file, 512));
        assertTrue(e.getMessage().contains("photo.jpg"));
    }

    @Test
    void rejectsEmptyAndMissingFiles() throws Exception {
        final var empty = Files.createFile(tempDir.resolve("empty.png"));

        assertThrows(EncodingFailureException.class, () -> encoder.encode(empty, 512));
        assertThrows(EncodingFailureException.class, () -> encoder.encode(tempDir.resolve("missing.png"), 512));
    }
}
