package org.tsticker.manager.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsticker.manager.Manager;
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
import org.tsticker.manager.api.PackNames;
import org.tsticker.manager.api.PackNotFoundException;
import org.tsticker.manager.api.PullResult;
import org.tsticker.manager.api.PushResult;
import org.tsticker.manager.api.RemoteFailureException;
import org.tsticker.manager.api.StickerPackLink;
import org.tsticker.manager.api.StickerType;
import org.tsticker.manager.helper.Context;
import org.tsticker.manager.helper.LocalInventory;
import org.tsticker.manager.storage.pack.IndexStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class ManagerImpl implements Manager {

    private final static Logger logger = LoggerFactory.getLogger(ManagerImpl.class);

    private final Context context;

    public ManagerImpl(final Context context) {
        this.context = context;
    }

    @Override
    public Credential getCredential() {
        return context.getCredential();
    }

    @Override
    public InitResult initPack(
            final Path parentDir, final String name, final String title, final StickerType stickerType
    ) throws InvalidPackException, PackAlreadyExistsException, RemoteFailureException, IOException {
        PackNames.validateName(name);
        PackNames.validateTitle(title);

        final var operator = context.getCredential().operator();
        final var collectionName = PackNames.toCollectionName(name, operator.username());
        final var paths = createPackDir(parentDir.resolve(name));
        final var pack = IndexStore.create(title, collectionName, stickerType, operator.id());
        context.getIndexStore().save(paths.indexFile(), pack);
        logger.info("Initialized pack {} in {}", collectionName, paths.packDir());

        final var orchestrator = context.getSyncOrchestrator();
        final var collection = orchestrator.fetch(collectionName);
        if (collection.isEmpty()) {
            logger.debug("Collection {} does not exist yet", collectionName);
            return new InitResult(paths.packDir(), pack, null);
        }
        final var pull = orchestrator.reindex(paths, pack, collection.get());
        return new InitResult(paths.packDir(), loadIndex(paths), pull);
    }

    @Override
    public InitResult tracePack(
            final Path parentDir, final StickerPackLink link
    ) throws CollectionNotFoundException, PackAlreadyExistsException, RemoteFailureException, IOException {
        final var orchestrator = context.getSyncOrchestrator();
        final var collection = orchestrator.fetch(link.name())
                .orElseThrow(() -> new CollectionNotFoundException(link.name()));

        final var paths = createPackDir(parentDir.resolve(collection.name()));
        final var pack = IndexStore.create(collection.title(),
                collection.name(),
                collection.stickerType(),
                context.getCredential().operator().id());
        context.getIndexStore().save(paths.indexFile(), pack);
        logger.info("Tracing collection {} in {}", collection.name(), paths.packDir());

        final var pull = orchestrator.reindex(paths, pack, collection);
        return new InitResult(paths.packDir(), loadIndex(paths), pull);
    }

    @Override
    public int downloadPack(
            final Path targetDir, final StickerPackLink link
    ) throws CollectionNotFoundException, RemoteFailureException, IOException {
        if (!Files.isDirectory(targetDir)) {
            throw new NoSuchFileException(targetDir.toString(), null, "Download directory does not exist");
        }
        final var collection = context.getSyncOrchestrator()
                .fetch(link.name())
                .orElseThrow(() -> new CollectionNotFoundException(link.name()));

        final var packDir = targetDir.resolve(collection.name());
        Files.createDirectories(packDir);
        new LocalInventory(packDir).scan();
        return context.getStickerDownloader().downloadAll(collection, packDir);
    }

    @Override
    public Pack loadPack(final Path packDir) throws PackNotFoundException, CorruptedIndexException, IOException {
        final var paths = PathConfig.createDefault(packDir);
        if (!Files.isRegularFile(paths.indexFile())) {
            throw new PackNotFoundException("Index file not found in "
                    + packDir.toAbsolutePath()
                    + ". Please run this command in an initialized pack directory.");
        }
        final var pack = context.getIndexStore().load(paths.indexFile());
        try {
            PackNames.validateName(pack.name());
            PackNames.validateTitle(pack.title());
        } catch (InvalidPackException e) {
            throw new CorruptedIndexException(e.getMessage(), e);
        }

        final var operator = context.getCredential().operator();
        if (!operator.id().equals(pack.operatorId())) {
            logger.warn("Pack {} was created by bot {}, but you are logged in as {} ({}). "
                    + "Collections can only be managed by the bot that created them.",
                    pack.name(),
                    pack.operatorId(),
                    operator.username(),
                    operator.id());
        }
        if (!Files.isDirectory(paths.stickersPath())) {
            throw new PackNotFoundException("Sticker directory not found: "
                    + paths.stickersPath().toAbsolutePath()
                    + ". Restore it from "
                    + paths.snapshotsPath()
                    + " or create it empty.");
        }
        return pack;
    }

    @Override
    public PullResult sync(
            final Path packDir
    ) throws PackNotFoundException, CorruptedIndexException, CollectionNotFoundException, RemoteFailureException,
            IOException {
        final var pack = loadPack(packDir);
        return context.getSyncOrchestrator().pull(PathConfig.createDefault(packDir), pack);
    }

    @Override
    public PushResult push(
            final Path packDir
    ) throws PackNotFoundException, CorruptedIndexException, IOException, RemoteFailureException,
            CapacityExceededException, CreationSizeInvalidException, EncodingFailureException {
        final var pack = loadPack(packDir);
        return context.getSyncOrchestrator().push(PathConfig.createDefault(packDir), pack);
    }

    private static PathConfig createPackDir(final Path packDir) throws PackAlreadyExistsException, IOException {
        if (Files.exists(packDir)) {
            throw new PackAlreadyExistsException(packDir);
        }
        final var paths = PathConfig.createDefault(packDir);
        Files.createDirectories(paths.stickersPath());
        return paths;
    }

    private Pack loadIndex(final PathConfig paths) throws IOException {
        try {
            return context.getIndexStore().load(paths.indexFile());
        } catch (CorruptedIndexException e) {
            throw new IOException("Index just written to " + paths.indexFile() + " could not be read back", e);
        }
    }

    @Override
    public void close() {
        context.getRemoteCallExecutor().close();
        context.getRemoteClient().close();
    }
}
