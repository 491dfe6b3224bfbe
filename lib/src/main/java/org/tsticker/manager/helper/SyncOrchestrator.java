package org.tsticker.manager.helper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsticker.manager.api.CapacityExceededException;
import org.tsticker.manager.api.CollectionNotFoundException;
import org.tsticker.manager.api.CreationSizeInvalidException;
import org.tsticker.manager.api.Emote;
import org.tsticker.manager.api.EncodingFailureException;
import org.tsticker.manager.api.Pack;
import org.tsticker.manager.api.PullResult;
import org.tsticker.manager.api.PushResult;
import org.tsticker.manager.api.RemoteCollection;
import org.tsticker.manager.api.RemoteFailureException;
import org.tsticker.manager.api.RemoteItem;
import org.tsticker.manager.config.ServiceConfig;
import org.tsticker.manager.internal.PathConfig;
import org.tsticker.manager.remote.CollectionLookup;
import org.tsticker.manager.remote.NewSticker;
import org.tsticker.manager.util.EmojiUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the pull (remote to local) and push (local to remote) flows of one pack.
 */
public class SyncOrchestrator {

    private final static Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final Context context;
    private State state = State.IDLE;

    SyncOrchestrator(final Context context) {
        this.context = context;
    }

    public State getState() {
        return state;
    }

    /**
     * Mirrors the remote collection into the sticker directory and rewrites the pack emotes.
     *
     * @throws CollectionNotFoundException if the collection has not been pushed yet
     */
    public PullResult pull(
            final PathConfig paths, final Pack pack
    ) throws CollectionNotFoundException, RemoteFailureException, IOException {
        begin();
        try {
            transition(State.FETCHING_REMOTE);
            final var lookup = lookup(pack.name());
            if (lookup instanceof CollectionLookup.Found found) {
                transition(State.HAS_REMOTE);
                return reindex(paths, pack, found.collection());
            }
            throw new CollectionNotFoundException(pack.name());
        } catch (final Exception e) {
            transition(State.ABORTED);
            throw e;
        }
    }

    /**
     * Applies the local sticker directory to the remote collection, creating it if needed, then reindexes.
     */
    public PushResult push(
            final PathConfig paths, final Pack pack
    ) throws IOException, RemoteFailureException, CapacityExceededException, CreationSizeInvalidException,
            EncodingFailureException {
        begin();
        try {
            return doPush(paths, pack);
        } catch (final Exception e) {
            transition(State.ABORTED);
            throw e;
        }
    }

    private PushResult doPush(
            final PathConfig paths, final Pack pack
    ) throws IOException, RemoteFailureException, CapacityExceededException, CreationSizeInvalidException,
            EncodingFailureException {
        if (!Files.isDirectory(paths.stickersPath())) {
            throw new NoSuchFileException(paths.stickersPath().toString(), null, "Sticker directory does not exist");
        }
        final var snapshot = context.getSnapshotManager().backup(paths.stickersPath(), paths.snapshotsPath());
        final var localFiles = new LocalInventory(paths.stickersPath()).scan();

        transition(State.FETCHING_REMOTE);
        final var lookup = lookup(pack.name());

        final var outcome = new Outcome();
        if (lookup instanceof CollectionLookup.Found found) {
            transition(State.HAS_REMOTE);
            reconcileRemote(paths, pack, found.collection(), localFiles, outcome);
        } else {
            transition(State.EMPTY_REMOTE);
            outcome.uploaded = createCollection(pack, localFiles);
            outcome.created = true;
        }

        transition(State.FETCHING_REMOTE);
        final var after = lookup(pack.name());
        PullResult reindex = null;
        if (after instanceof CollectionLookup.Found found) {
            reindex = reindex(paths, pack, found.collection());
        } else {
            logger.warn("Collection {} not found after push, index not updated", pack.name());
            transition(State.DONE);
        }

        return new PushResult(snapshot,
                outcome.created,
                outcome.titleUpdated,
                outcome.deleted,
                outcome.uploaded,
                outcome.fixed,
                outcome.failures,
                outcome.repairsAborted,
                reindex);
    }

    /**
     * @return number of stickers the collection was created with
     */
    private int createCollection(
            final Pack pack, final List<LocalFile> localFiles
    ) throws CreationSizeInvalidException, EncodingFailureException, RemoteFailureException {
        context.getDiffEngine().checkCreationSize(localFiles.size());

        transition(State.RECONCILING);
        final var stickers = new ArrayList<NewSticker>(localFiles.size());
        for (var file : localFiles) {
            stickers.add(toNewSticker(pack, file));
        }

        final var client = context.getRemoteClient();
        final var ownerId = context.getCredential().ownerId();
        context.getRemoteCallExecutor().execute("create collection " + pack.name(), () -> {
            client.createCollection(ownerId, pack.name(), pack.title(), pack.stickerType(), stickers);
            return null;
        });
        logger.info("Created collection {} with {} stickers", pack.name(), stickers.size());
        return stickers.size();
    }

    private void reconcileRemote(
            final PathConfig paths,
            final Pack pack,
            final RemoteCollection collection,
            final List<LocalFile> localFiles,
            final Outcome outcome
    ) throws CapacityExceededException, RemoteFailureException {
        final var diffEngine = context.getDiffEngine();
        final var delta = diffEngine.diff(localFiles, collection.items());
        if (!delta.isEmpty()) {
            logger.info("Changes detected: {} to delete, {} to upload, {} to fix",
                    delta.toDelete().size(),
                    delta.toUpload().size(),
                    delta.toFix().size());
        }
        diffEngine.checkCapacity(collection.size(), delta);

        transition(State.RECONCILING);
        final var client = context.getRemoteClient();
        final var executor = context.getRemoteCallExecutor();

        if (!pack.title().equals(collection.title())) {
            executor.execute("rename collection " + pack.name(), () -> {
                client.renameCollection(pack.name(), pack.title());
                return null;
            });
            outcome.titleUpdated = true;
            logger.info("Title updated to {}", pack.title());
        }

        for (var item : delta.toDelete()) {
            try {
                executor.execute("delete sticker " + item.uniqueContentId(), () -> {
                    client.deleteItem(item.contentId());
                    return null;
                });
                outcome.deleted++;
                logger.info("Deleted sticker {}", item.uniqueContentId());
            } catch (RemoteFailureException e) {
                logger.warn("Failed to delete sticker {}: {}", item.uniqueContentId(), e.getMessage());
                outcome.fail(PushResult.Operation.DELETE, item.uniqueContentId(), e.getMessage());
            }
        }

        final var ownerId = context.getCredential().ownerId();
        for (var file : delta.toUpload()) {
            final var fileName = file.path().getFileName().toString();
            final NewSticker sticker;
            try {
                sticker = toNewSticker(pack, file);
            } catch (EncodingFailureException e) {
                logger.warn(e.getMessage());
                outcome.fail(PushResult.Operation.UPLOAD, fileName, e.getMessage());
                continue;
            }
            try {
                executor.execute("add sticker " + fileName, () -> {
                    client.addItem(ownerId, pack.name(), sticker);
                    return null;
                });
            } catch (RemoteFailureException e) {
                logger.warn("Failed to upload sticker {}: {}", fileName, e.getMessage());
                outcome.fail(PushResult.Operation.UPLOAD, fileName, e.getMessage());
                continue;
            }
            outcome.uploaded++;
            logger.info("Uploaded sticker {}", fileName);
            // the reindex downloads it again under its remote id
            deleteUploaded(file.path());
        }

        final var downloader = context.getStickerDownloader();
        for (var repair : delta.toFix()) {
            final var local = repair.local();
            try {
                final var written = downloader.download(repair.remote(), paths.stickersPath());
                if (!written.equals(local.path())) {
                    Files.deleteIfExists(local.path());
                }
                outcome.fixed++;
                logger.info("Corrected sticker {}", local.contentKey());
            } catch (RemoteFailureException | IOException e) {
                logger.error("Failed to correct sticker {}, skipping remaining corrections: {}",
                        local.contentKey(),
                        e.getMessage());
                outcome.fail(PushResult.Operation.FIX, local.contentKey(), e.getMessage());
                outcome.repairsAborted = true;
                break;
            }
        }
    }

    /**
     * Pull against an already fetched collection.
     */
    public PullResult reindex(
            final PathConfig paths, final Pack pack, final RemoteCollection collection
    ) throws RemoteFailureException, IOException {
        transition(State.RECONCILING);
        final var stickersPath = paths.stickersPath();
        final var localFiles = new LocalInventory(stickersPath).scan();
        final Map<String, RemoteItem> remote = new LinkedHashMap<>();
        for (var item : collection.items()) {
            remote.putIfAbsent(item.uniqueContentId(), item);
        }

        final var downloader = context.getStickerDownloader();
        final var present = new HashSet<String>();
        var removed = 0;
        var redownloaded = 0;
        for (var file : localFiles) {
            final var item = remote.get(file.contentKey());
            if (item == null) {
                logger.info("Cleaning up {}", file.path().getFileName());
                Files.deleteIfExists(file.path());
                removed++;
                continue;
            }
            present.add(file.contentKey());
            if (file.byteSize() != item.byteSize()) {
                logger.warn("File size mismatch for {}, re-downloading", file.path().getFileName());
                Files.deleteIfExists(file.path());
                downloader.download(item, stickersPath);
                redownloaded++;
            }
        }

        var downloaded = 0;
        for (var item : remote.values()) {
            if (!present.contains(item.uniqueContentId())) {
                downloader.download(item, stickersPath);
                downloaded++;
            }
        }

        transition(State.REINDEXING);
        final var emotes = remote.values()
                .stream()
                .map(i -> new Emote(i.emoji() == null ? ServiceConfig.DEFAULT_EMOJI : i.emoji(),
                        i.uniqueContentId()))
                .toList();
        context.getIndexStore().save(paths.indexFile(), pack.withEmotes(emotes));
        transition(State.DONE);
        logger.info("Synchronized {}: {} downloaded, {} removed, {} re-downloaded",
                pack.name(),
                downloaded,
                removed,
                redownloaded);
        return new PullResult(downloaded, removed, redownloaded, emotes.size());
    }

    public Optional<RemoteCollection> fetch(final String name) throws RemoteFailureException {
        if (lookup(name) instanceof CollectionLookup.Found found) {
            return Optional.of(found.collection());
        }
        return Optional.empty();
    }

    private NewSticker toNewSticker(final Pack pack, final LocalFile file) throws EncodingFailureException {
        final var encoded = context.getStickerEncoder().encode(file.path(), pack.stickerType().getScale());
        var emojis = EmojiUtils.extractEmojis(file.contentKey());
        if (emojis.isEmpty()) {
            emojis = encoded.emojiHints();
        }
        if (emojis.isEmpty()) {
            emojis = List.of(ServiceConfig.DEFAULT_EMOJI);
        }
        return new NewSticker(file.path().getFileName().toString(), encoded.data(), encoded.format(), emojis);
    }

    private CollectionLookup lookup(final String name) throws RemoteFailureException {
        final var client = context.getRemoteClient();
        return context.getRemoteCallExecutor()
                .executeRead("get collection " + name, () -> client.getCollection(name));
    }

    private static void deleteUploaded(final Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Failed to delete uploaded file {}: {}", file.getFileName(), e.getMessage());
        }
    }

    private void begin() {
        state = State.IDLE;
    }

    private void transition(final State next) {
        logger.debug("Sync state {} -> {}", state, next);
        state = next;
    }

    public enum State {
        IDLE,
        FETCHING_REMOTE,
        EMPTY_REMOTE,
        HAS_REMOTE,
        RECONCILING,
        REINDEXING,
        DONE,
        ABORTED
    }

    private static final class Outcome {

        private boolean created;
        private boolean titleUpdated;
        private int deleted;
        private int uploaded;
        private int fixed;
        private boolean repairsAborted;
        private final List<PushResult.Failure> failures = new ArrayList<>();

        private void fail(final PushResult.Operation operation, final String item, final String message) {
            failures.add(new PushResult.Failure(operation, item, message));
        }
    }
}
