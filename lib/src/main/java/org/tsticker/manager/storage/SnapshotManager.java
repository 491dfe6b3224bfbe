package org.tsticker.manager.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsticker.manager.util.IOUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Keeps rotating copies of the sticker directory in {@code <pack dir>/.snapshots}, taken before a push mutates
 * the remote collection.
 */
public class SnapshotManager {

    private final static Logger logger = LoggerFactory.getLogger(SnapshotManager.class);

    public static final String SNAPSHOT_DIR_NAME = ".snapshots";
    private static final String PREFIX = "stickers_";
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern SNAPSHOT_NAME = Pattern.compile("^" + PREFIX + "(\\d{8}_\\d{6})(?:_(\\d{1,9}))?$");

    private final int retention;
    private final Clock clock;

    public SnapshotManager(final int retention) {
        this(retention, Clock.systemDefaultZone());
    }

    public SnapshotManager(final int retention, final Clock clock) {
        if (retention < 1) {
            throw new IllegalArgumentException("retention must be positive");
        }
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * Copies the sticker directory into a new snapshot below {@code snapshotRoot}, evicting the oldest snapshots
     * first so that at most {@code retention} snapshots exist afterwards.
     *
     * @return the created snapshot directory
     */
    public Path backup(final Path stickerDir, final Path snapshotRoot) throws IOException {
        IOUtils.createPrivateDirectories(snapshotRoot.toFile());
        if (!Files.isDirectory(snapshotRoot)) {
            throw new NotDirectoryException(snapshotRoot.toString());
        }

        final var existing = listSnapshots(snapshotRoot);
        var count = existing.size();
        for (var snapshot : existing) {
            if (count < retention) {
                break;
            }
            logger.debug("Removing old snapshot {}", snapshot.path().getFileName());
            IOUtils.deleteRecursively(snapshot.path());
            count--;
        }

        final var target = newSnapshotPath(snapshotRoot);
        IOUtils.copyRecursively(stickerDir, target);
        logger.info("Created snapshot {}", target);
        return target;
    }

    /**
     * @return the snapshots in the given directory, oldest first
     */
    public List<Path> listSnapshotPaths(final Path snapshotRoot) throws IOException {
        return listSnapshots(snapshotRoot).stream().map(Snapshot::path).toList();
    }

    private List<Snapshot> listSnapshots(final Path snapshotRoot) throws IOException {
        if (!Files.isDirectory(snapshotRoot)) {
            return List.of();
        }
        final var snapshots = new ArrayList<Snapshot>();
        try (var stream = Files.list(snapshotRoot)) {
            for (var path : stream.toList()) {
                if (!Files.isDirectory(path)) {
                    continue;
                }
                final var matcher = SNAPSHOT_NAME.matcher(path.getFileName().toString());
                if (!matcher.matches()) {
                    continue;
                }
                final LocalDateTime timestamp;
                try {
                    timestamp = LocalDateTime.parse(matcher.group(1), TIMESTAMP_FORMAT);
                } catch (DateTimeParseException e) {
                    logger.debug("Ignoring snapshot with invalid timestamp {}", path.getFileName());
                    continue;
                }
                final var sequence = matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2));
                snapshots.add(new Snapshot(path, timestamp, sequence));
            }
        }
        snapshots.sort(Comparator.comparing(Snapshot::timestamp).thenComparingInt(Snapshot::sequence));
        return snapshots;
    }

    private Path newSnapshotPath(final Path snapshotRoot) {
        final var base = PREFIX + LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
        var candidate = snapshotRoot.resolve(base);
        var sequence = 1;
        while (Files.exists(candidate)) {
            candidate = snapshotRoot.resolve(base + "_" + sequence++);
        }
        return candidate;
    }

    private record Snapshot(Path path, LocalDateTime timestamp, int sequence) {}
}
