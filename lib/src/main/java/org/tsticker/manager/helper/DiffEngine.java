package org.tsticker.manager.helper;

import org.tsticker.manager.api.CapacityExceededException;
import org.tsticker.manager.api.CreationSizeInvalidException;
import org.tsticker.manager.api.RemoteItem;
import org.tsticker.manager.config.ServiceConfig;

import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Compares the local sticker directory with the remote collection, the local side being the source of truth.
 */
public class DiffEngine {

    public StickerDelta diff(final List<LocalFile> localFiles, final List<RemoteItem> remoteItems) {
        final var local = localFiles.stream()
                .collect(Collectors.toMap(LocalFile::contentKey, Function.identity(), (a, b) -> a));
        final var remote = remoteItems.stream()
                .collect(Collectors.toMap(RemoteItem::uniqueContentId, Function.identity(), (a, b) -> a));

        final var toUpload = localFiles.stream()
                .filter(f -> !remote.containsKey(f.contentKey()))
                .sorted(Comparator.comparing(LocalFile::contentKey))
                .toList();
        final var toDelete = remoteItems.stream().filter(i -> !local.containsKey(i.uniqueContentId())).toList();
        final var toFix = localFiles.stream()
                .filter(f -> remote.containsKey(f.contentKey()))
                .filter(f -> f.byteSize() != remote.get(f.contentKey()).byteSize())
                .sorted(Comparator.comparing(LocalFile::contentKey))
                .map(f -> new StickerDelta.Repair(f, remote.get(f.contentKey())))
                .toList();

        return new StickerDelta(toUpload, toDelete, toFix);
    }

    public void checkCapacity(final int remoteCount, final StickerDelta delta) throws CapacityExceededException {
        final var resultingSize = remoteCount - delta.toDelete().size() + delta.toUpload().size();
        if (resultingSize > ServiceConfig.MAX_COLLECTION_SIZE) {
            throw new CapacityExceededException(resultingSize, ServiceConfig.MAX_COLLECTION_SIZE);
        }
    }

    public void checkCreationSize(final int count) throws CreationSizeInvalidException {
        if (count == 0) {
            throw new CreationSizeInvalidException(
                    "There are no stickers to create the collection with, place your stickers in the stickers folder",
                    count);
        }
        if (count > ServiceConfig.MAX_INITIAL_BATCH_SIZE) {
            throw new CreationSizeInvalidException("A new collection can be created with at most "
                    + ServiceConfig.MAX_INITIAL_BATCH_SIZE
                    + " stickers, found "
                    + count, count);
        }
    }
}
