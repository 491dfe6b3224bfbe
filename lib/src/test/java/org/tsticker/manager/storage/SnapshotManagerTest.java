package org.tsticker.manager.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tsticker.manager.TestFiles;

import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotManagerTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path packDir;

    @Test
    void copiesStickerDirectory() throws Exception {
        final var stickers = packDir.resolve("stickers");
        TestFiles.writePng(stickers, "a.png", 100);
        TestFiles.writePng(stickers, "b.png", 200);

        final var snapshot = managerAt(0).backup(stickers, packDir.resolve(".snapshots"));

        assertEquals(packDir.resolve(".snapshots").resolve("stickers_20240501_100000"), snapshot);
        assertArrayEquals(Files.readAllBytes(stickers.resolve("a.png")), Files.readAllBytes(snapshot.resolve("a.png")));
        assertEquals(200, Files.size(snapshot.resolve("b.png")));
    }

    @Test
    void fifthBackupEvictsOldest() throws Exception {
        final var stickers = packDir.resolve("stickers");
        TestFiles.writePng(stickers, "a.png", 10);

        final var created = new ArrayList<Path>();
        for (var i = 0; i < 5; i++) {
            created.add(managerAt(i * 60).backup(stickers, packDir.resolve(".snapshots")));
        }

        final var remaining = managerAt(0).listSnapshotPaths(packDir.resolve(".snapshots"));
        assertEquals(4, remaining.size());
        assertFalse(Files.exists(created.get(0)));
        assertEquals(created.subList(1, 5), remaining);
    }

    @Test
    void evictionUsesTimestampOrder() throws Exception {
        final var stickers = packDir.resolve("stickers");
        TestFiles.writePng(stickers, "a.png", 10);
        final var snapshots = packDir.resolve(".snapshots");
        // created out of order, the oldest timestamp must go first
        Files.createDirectories(snapshots.resolve("stickers_20240301_000000"));
        Files.createDirectories(snapshots.resolve("stickers_20240101_000000"));
        Files.createDirectories(snapshots.resolve("stickers_20240201_000000"));
        Files.createDirectories(snapshots.resolve("stickers_20240401_000000"));

        managerAt(0).backup(stickers, packDir.resolve(".snapshots"));

        assertFalse(Files.exists(snapshots.resolve("stickers_20240101_000000")));
        assertTrue(Files.exists(snapshots.resolve("stickers_20240201_000000")));
        assertEquals(4, managerAt(0).listSnapshotPaths(snapshots).size());
    }

    @Test
    void sameSecondSnapshotsGetDistinctNames() throws Exception {
        final var stickers = packDir.resolve("stickers");
        TestFiles.writePng(stickers, "a.png", 10);
        final var manager = managerAt(0);

        final var first = manager.backup(stickers, packDir.resolve(".snapshots"));
        final var second = manager.backup(stickers, packDir.resolve(".snapshots"));

        assertNotEquals(first, second);
        assertEquals("stickers_20240501_100000_1", second.getFileName().toString());
        assertEquals(2, manager.listSnapshotPaths(packDir.resolve(".snapshots")).size());
    }

    @Test
    void ignoresUnrelatedEntries() throws Exception {
        final var stickers = packDir.resolve("stickers");
        TestFiles.writePng(stickers, "a.png", 10);
        final var snapshots = packDir.resolve(".snapshots");
        Files.createDirectories(snapshots.resolve("notes"));

        managerAt(0).backup(stickers, packDir.resolve(".snapshots"));

        assertTrue(Files.exists(snapshots.resolve("notes")));
        assertEquals(1, managerAt(0).listSnapshotPaths(snapshots).size());
    }

    @Test
    void ignoresSnapshotsWithOverlongSequence() throws Exception {
        final var stickers = packDir.resolve("stickers");
        TestFiles.writePng(stickers, "a.png", 10);
        final var snapshots = packDir.resolve(".snapshots");
        Files.createDirectories(snapshots.resolve("stickers_20240101_000000_99999999999"));

        final var snapshot = managerAt(0).backup(stickers, snapshots);

        assertTrue(Files.exists(snapshots.resolve("stickers_20240101_000000_99999999999")));
        assertEquals(List.of(snapshot), managerAt(0).listSnapshotPaths(snapshots));
    }

    @Test
    void snapshotRootThatIsAFileFailsBackup() throws Exception {
        final var stickers = packDir.resolve("stickers");
        TestFiles.writePng(stickers, "a.png", 10);
        final var snapshots = packDir.resolve(".snapshots");
        Files.writeString(snapshots, "x");

        assertThrows(NotDirectoryException.class, () -> managerAt(0).backup(stickers, snapshots));
        assertEquals("x", Files.readString(snapshots));
    }

    private static SnapshotManager managerAt(final long secondsAfterStart) {
        return new SnapshotManager(4, Clock.fixed(START.plusSeconds(secondsAfterStart), ZoneOffset.UTC));
    }
}
