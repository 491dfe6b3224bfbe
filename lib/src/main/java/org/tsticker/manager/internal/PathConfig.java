package org.tsticker.manager.internal;

import org.tsticker.manager.storage.SnapshotManager;

import java.nio.file.Path;

public record PathConfig(Path packDir, Path indexFile, Path stickersPath, Path snapshotsPath) {

    public static PathConfig createDefault(final Path packDir) {
        return new PathConfig(packDir,
                packDir.resolve("index.json"),
                packDir.resolve("stickers"),
                packDir.resolve(SnapshotManager.SNAPSHOT_DIR_NAME));
    }
}
