package org.tsticker.manager.api;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a push.
 *
 * @param created      whether the remote collection was created by this push
 * @param failures     per item failures that did not stop the push
 * @param repairsAborted true if a failed repair stopped the remaining repairs
 * @param reindex      result of the pull that reindexed the pack, null if the collection was not found afterwards
 */
public record PushResult(
        Path snapshot,
        boolean created,
        boolean titleUpdated,
        int deleted,
        int uploaded,
        int fixed,
        List<Failure> failures,
        boolean repairsAborted,
        PullResult reindex
) {

    public PushResult {
        failures = List.copyOf(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty() && !repairsAborted;
    }

    public record Failure(Operation operation, String item, String message) {}

    public enum Operation {
        DELETE,
        UPLOAD,
        FIX
    }
}
