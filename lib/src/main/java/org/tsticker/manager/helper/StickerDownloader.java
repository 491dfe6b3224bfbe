package org.tsticker.manager.helper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsticker.manager.api.RemoteCollection;
import org.tsticker.manager.api.RemoteFailureException;
import org.tsticker.manager.api.RemoteItem;
import org.tsticker.manager.util.MimeUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class StickerDownloader {

    private final static Logger logger = LoggerFactory.getLogger(StickerDownloader.class);

    private final Context context;

    StickerDownloader(final Context context) {
        this.context = context;
    }

    /**
     * Fetches the file of a remote sticker and stores it as {@code <unique id>.<detected extension>}.
     */
    public Path download(final RemoteItem item, final Path targetDir) throws RemoteFailureException, IOException {
        final var client = context.getRemoteClient();
        final var data = context.getRemoteCallExecutor()
                .execute("fetch file " + item.uniqueContentId(), () -> client.fetchFile(item.contentId()));
        if (data == null || data.length == 0) {
            throw new RemoteFailureException("Failed to download file: " + item.uniqueContentId());
        }

        final var extension = MimeUtils.detectExtension(data);
        final var target = targetDir.resolve(item.uniqueContentId() + "." + extension);
        Files.createDirectories(targetDir);
        Files.write(target, data);
        logger.info("Downloaded sticker {}", target.getFileName());
        return target;
    }

    /**
     * Downloads every sticker of a collection into the given directory.
     *
     * @return number of downloaded files
     */
    public int downloadAll(
            final RemoteCollection collection, final Path targetDir
    ) throws RemoteFailureException, IOException {
        var count = 0;
        for (var item : collection.items()) {
            download(item, targetDir);
            count++;
            logger.debug("Downloaded {}/{} stickers of {}", count, collection.size(), collection.name());
        }
        return count;
    }
}
