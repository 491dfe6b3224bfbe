package org.tsticker.manager.helper;

import org.tsticker.manager.api.RemoteItem;

import java.util.List;

public record StickerDelta(List<LocalFile> toUpload, List<RemoteItem> toDelete, List<Repair> toFix) {

    public StickerDelta {
        toUpload = List.copyOf(toUpload);
        toDelete = List.copyOf(toDelete);
        toFix = List.copyOf(toFix);
    }

    public boolean isEmpty() {
        return toUpload.isEmpty() && toDelete.isEmpty() && toFix.isEmpty();
    }

    /**
     * A sticker present on both sides whose local copy differs in size from the remote one.
     */
    public record Repair(LocalFile local, RemoteItem remote) {}
}
