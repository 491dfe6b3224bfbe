package org.tsticker.util;

import org.tsticker.manager.api.PullResult;
import org.tsticker.manager.api.PushResult;
import org.tsticker.output.PlainTextWriter;

import java.util.List;

public class SyncResultUtils {

    private SyncResultUtils() {
    }

    public static void printPullResult(final PlainTextWriter writer, final PullResult result) {
        if (!result.hasChanges()) {
            writer.println("Already up to date, {} stickers indexed.", result.emotes());
            return;
        }
        writer.println("Downloaded {}, re-downloaded {}, removed {} local files, {} stickers indexed.",
                result.downloaded(),
                result.redownloaded(),
                result.removed(),
                result.emotes());
    }

    public static void printPushResult(final PlainTextWriter writer, final PushResult result) {
        if (result.created()) {
            writer.println("Created collection with {} stickers.", result.uploaded());
        } else {
            if (result.titleUpdated()) {
                writer.println("Updated collection title.");
            }
            writer.println("Uploaded {}, deleted {}, fixed {} stickers.",
                    result.uploaded(),
                    result.deleted(),
                    result.fixed());
        }
        if (result.snapshot() != null) {
            writer.println("Snapshot of the local stickers: {}", result.snapshot());
        }
        if (!result.failures().isEmpty()) {
            writer.println("{} operations failed:", result.failures().size());
            writer.indent(w -> {
                for (final var failure : result.failures()) {
                    w.println("{} {}: {}", failure.operation(), failure.item(), failure.message());
                }
            });
        }
        if (result.repairsAborted()) {
            writer.println("Stopped repairing local files after the first failure, run push again later.");
        }
        if (result.reindex() == null) {
            writer.println("Collection not found after push, the local index was not updated.");
        } else {
            printPullResult(writer, result.reindex());
        }
    }

    public record JsonPullResult(int downloaded, int redownloaded, int removed, int emotes) {

        public static JsonPullResult from(PullResult result) {
            return result == null
                    ? null
                    : new JsonPullResult(result.downloaded(), result.redownloaded(), result.removed(), result.emotes());
        }
    }

    public record JsonPushResult(
            String snapshot,
            boolean created,
            boolean titleUpdated,
            int uploaded,
            int deleted,
            int fixed,
            List<JsonFailure> failures,
            boolean repairsAborted,
            JsonPullResult reindex
    ) {

        public static JsonPushResult from(PushResult result) {
            return new JsonPushResult(result.snapshot() == null ? null : result.snapshot().toString(),
                    result.created(),
                    result.titleUpdated(),
                    result.uploaded(),
                    result.deleted(),
                    result.fixed(),
                    result.failures()
                            .stream()
                            .map(f -> new JsonFailure(f.operation().name().toLowerCase(), f.item(), f.message()))
                            .toList(),
                    result.repairsAborted(),
                    JsonPullResult.from(result.reindex()));
        }
    }

    public record JsonFailure(String operation, String item, String message) {}
}
