package org.tsticker.manager.api;

public record PullResult(int downloaded, int removed, int redownloaded, int emotes) {

    public boolean hasChanges() {
        return downloaded > 0 || removed > 0 || redownloaded > 0;
    }
}
