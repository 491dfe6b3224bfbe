package org.tsticker.manager.api;

import java.nio.file.Path;

/**
 * @param pull null if the remote collection does not exist yet
 */
public record InitResult(Path packDir, Pack pack, PullResult pull) {

    public boolean remoteExists() {
        return pull != null;
    }
}
