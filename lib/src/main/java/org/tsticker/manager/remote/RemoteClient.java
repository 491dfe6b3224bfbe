package org.tsticker.manager.remote;

import org.tsticker.manager.api.OperatorIdentity;
import org.tsticker.manager.api.RemoteFailureException;
import org.tsticker.manager.api.StickerType;

import java.io.Closeable;
import java.util.List;

/**
 * Operations of the remote sticker service.
 * <p>
 * Implementations translate transport and protocol errors into {@link RemoteFailureException}, keeping the
 * provider's message. They are not required to be thread safe, calls are issued one at a time.
 */
public interface RemoteClient extends Closeable {

    OperatorIdentity getOperator() throws RemoteFailureException;

    CollectionLookup getCollection(String name) throws RemoteFailureException;

    void createCollection(
            String ownerId, String name, String title, StickerType stickerType, List<NewSticker> stickers
    ) throws RemoteFailureException;

    void addItem(String ownerId, String name, NewSticker sticker) throws RemoteFailureException;

    void deleteItem(String contentId) throws RemoteFailureException;

    void renameCollection(String name, String title) throws RemoteFailureException;

    byte[] fetchFile(String contentId) throws RemoteFailureException;

    @Override
    void close();
}
