package org.tsticker.manager.helper;

import org.tsticker.manager.Settings;
import org.tsticker.manager.api.Credential;
import org.tsticker.manager.encoder.StickerEncoder;
import org.tsticker.manager.internal.RemoteCallExecutor;
import org.tsticker.manager.remote.RemoteClient;
import org.tsticker.manager.storage.SnapshotManager;
import org.tsticker.manager.storage.pack.IndexStore;

import java.util.function.Supplier;

public class Context {

    private final Object LOCK = new Object();

    private final Credential credential;
    private final RemoteClient remoteClient;
    private final RemoteCallExecutor remoteCallExecutor;
    private final StickerEncoder stickerEncoder;
    private final IndexStore indexStore;
    private final SnapshotManager snapshotManager;

    private DiffEngine diffEngine;
    private StickerDownloader stickerDownloader;
    private SyncOrchestrator syncOrchestrator;

    public Context(
            final Credential credential,
            final RemoteClient remoteClient,
            final RemoteCallExecutor remoteCallExecutor,
            final StickerEncoder stickerEncoder,
            final Settings settings
    ) {
        this(credential,
                remoteClient,
                remoteCallExecutor,
                stickerEncoder,
                new IndexStore(),
                new SnapshotManager(settings.snapshotRetention()));
    }

    public Context(
            final Credential credential,
            final RemoteClient remoteClient,
            final RemoteCallExecutor remoteCallExecutor,
            final StickerEncoder stickerEncoder,
            final IndexStore indexStore,
            final SnapshotManager snapshotManager
    ) {
        this.credential = credential;
        this.remoteClient = remoteClient;
        this.remoteCallExecutor = remoteCallExecutor;
        this.stickerEncoder = stickerEncoder;
        this.indexStore = indexStore;
        this.snapshotManager = snapshotManager;
    }

    public Credential getCredential() {
        return credential;
    }

    public RemoteClient getRemoteClient() {
        return remoteClient;
    }

    public RemoteCallExecutor getRemoteCallExecutor() {
        return remoteCallExecutor;
    }

    public StickerEncoder getStickerEncoder() {
        return stickerEncoder;
    }

    public IndexStore getIndexStore() {
        return indexStore;
    }

    public SnapshotManager getSnapshotManager() {
        return snapshotManager;
    }

    public DiffEngine getDiffEngine() {
        return getOrCreate(() -> diffEngine, () -> diffEngine = new DiffEngine());
    }

    public StickerDownloader getStickerDownloader() {
        return getOrCreate(() -> stickerDownloader, () -> stickerDownloader = new StickerDownloader(this));
    }

    public SyncOrchestrator getSyncOrchestrator() {
        return getOrCreate(() -> syncOrchestrator, () -> syncOrchestrator = new SyncOrchestrator(this));
    }

    private <T> T getOrCreate(Supplier<T> supplier, Callable creator) {
        var value = supplier.get();
        if (value != null) {
            return value;
        }

        synchronized (LOCK) {
            value = supplier.get();
            if (value != null) {
                return value;
            }
            creator.call();
            return supplier.get();
        }
    }

    private interface Callable {

        void call();
    }
}
