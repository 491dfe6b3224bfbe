package org.tsticker.manager.api;

import java.util.List;

public record RemoteCollection(String name, String title, StickerType stickerType, List<RemoteItem> items) {

    public RemoteCollection {
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }
}
