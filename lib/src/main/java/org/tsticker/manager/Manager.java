package org.tsticker.manager;

import org.tsticker.manager.api.CapacityExceededException;
import org.tsticker.manager.api.CollectionNotFoundException;
import org.tsticker.manager.api.CorruptedIndexException;
import org.tsticker.manager.api.CreationSizeInvalidException;
import org.tsticker.manager.api.Credential;
import org.tsticker.manager.api.EncodingFailureException;
import org.tsticker.manager.api.InitResult;
import org.tsticker.manager.api.InvalidPackException;
import org.tsticker.manager.api.Pack;
import org.tsticker.manager.api.PackAlreadyExistsException;
import org.tsticker.manager.api.PackNotFoundException;
import org.tsticker.manager.api.PullResult;
import org.tsticker.manager.api.PushResult;
import org.tsticker.manager.api.RemoteFailureException;
import org.tsticker.manager.api.StickerPackLink;
import org.tsticker.manager.api.StickerType;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

public interface Manager extends Closeable {

    Credential getCredential();

    /**
     * Creates {@code <parentDir>/<name>} with a fresh index and an empty sticker directory. If the collection
     * already exists remotely, its stickers are pulled.
     */
    InitResult initPack(
            Path parentDir, String name, String title, StickerType stickerType
    ) throws InvalidPackException, PackAlreadyExistsException, RemoteFailureException, IOException;

    /**
     * Creates a local pack for an existing remote collection and pulls it.
     */
    InitResult tracePack(
            Path parentDir, StickerPackLink link
    ) throws CollectionNotFoundException, PackAlreadyExistsException, RemoteFailureException, IOException;

    /**
     * Downloads all stickers of a collection into {@code <targetDir>/<name>}, without creating an index.
     *
     * @return number of downloaded stickers
     */
    int downloadPack(
            Path targetDir, StickerPackLink link
    ) throws CollectionNotFoundException, RemoteFailureException, IOException;

    Pack loadPack(Path packDir) throws PackNotFoundException, CorruptedIndexException, IOException;

    PullResult sync(
            Path packDir
    ) throws PackNotFoundException, CorruptedIndexException, CollectionNotFoundException, RemoteFailureException,
            IOException;

    PushResult push(
            Path packDir
    ) throws PackNotFoundException, CorruptedIndexException, IOException, RemoteFailureException,
            CapacityExceededException, CreationSizeInvalidException, EncodingFailureException;

    @Override
    void close();
}
