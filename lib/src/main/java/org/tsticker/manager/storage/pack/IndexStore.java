package org.tsticker.manager.storage.pack;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsticker.manager.api.CorruptedIndexException;
import org.tsticker.manager.api.Emote;
import org.tsticker.manager.api.Pack;
import org.tsticker.manager.api.StickerType;
import org.tsticker.manager.storage.Utils;
import org.tsticker.manager.util.IOUtils;
import org.tsticker.manager.util.IntegrityUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes the pack index. Every load verifies the integrity tag, a tampered or malformed index is
 * rejected and never repaired.
 */
public class IndexStore {

    private final static Logger logger = LoggerFactory.getLogger(IndexStore.class);

    private final ObjectMapper objectMapper = Utils.createStorageObjectMapper();

    public static Pack create(
            final String title, final String name, final StickerType stickerType, final String operatorId
    ) {
        final var tag = IntegrityUtils.computeIntegrityTag(operatorId, name, stickerType);
        return new Pack(title, name, stickerType, operatorId, tag, List.of());
    }

    public Pack load(final Path indexFile) throws IOException, CorruptedIndexException {
        final var content = Files.readAllBytes(indexFile);

        final JsonPack storage;
        try {
            storage = objectMapper.readValue(content, JsonPack.class);
        } catch (IOException e) {
            logger.debug("Failed to parse index file {}", indexFile, e);
            throw new CorruptedIndexException("Index file " + indexFile + " is not valid: " + e.getMessage(), e);
        }
        if (storage == null) {
            throw new CorruptedIndexException("Index file " + indexFile + " is empty");
        }

        final var pack = fromStorage(indexFile, storage);
        final var expected = IntegrityUtils.computeIntegrityTag(pack.operatorId(), pack.name(), pack.stickerType());
        if (!IntegrityUtils.matches(expected, pack.integrityTag())) {
            throw new CorruptedIndexException("Index file "
                    + indexFile
                    + " has been modified, the pack name, type or operator no longer match its lock");
        }
        return pack;
    }

    public void save(final Path indexFile, final Pack pack) throws IOException {
        final var storage = toStorage(pack);
        try (var output = new ByteArrayOutputStream()) {
            // Write to memory first to prevent corrupting the file in case of serialization errors
            objectMapper.writeValue(output, storage);
            IOUtils.writeAtomically(indexFile, output.toByteArray());
        }
        logger.debug("Saved index {} with {} emotes", indexFile, pack.emotes().size());
    }

    private static Pack fromStorage(final Path indexFile, final JsonPack storage) throws CorruptedIndexException {
        final var title = requireField(indexFile, "title", storage.title());
        final var name = requireField(indexFile, "name", storage.name());
        final var operatorId = requireField(indexFile, "operator_id", storage.operatorId());
        final var lock = requireField(indexFile, "lock_ns", storage.lockNs());
        final var typeValue = requireField(indexFile, "sticker_type", storage.stickerType());

        final StickerType stickerType;
        try {
            stickerType = StickerType.fromValue(typeValue);
        } catch (IllegalArgumentException e) {
            throw new CorruptedIndexException("Index file " + indexFile + " has an unknown sticker type: " + typeValue,
                    e);
        }

        final var jsonEmotes = storage.emotes() == null ? List.<JsonPack.JsonEmote>of() : storage.emotes();
        for (var emote : jsonEmotes) {
            if (emote == null || emote.fileId() == null || emote.emoji() == null) {
                throw new CorruptedIndexException("Index file " + indexFile + " contains an incomplete emote");
            }
        }
        final var emotes = jsonEmotes.stream().map(e -> new Emote(e.emoji(), e.fileId())).toList();
        return new Pack(title, name, stickerType, operatorId, lock, emotes);
    }

    private static String requireField(
            final Path indexFile, final String field, final String value
    ) throws CorruptedIndexException {
        if (value == null) {
            throw new CorruptedIndexException("Index file " + indexFile + " is missing the field " + field);
        }
        return value;
    }

    private static JsonPack toStorage(final Pack pack) {
        return new JsonPack(pack.title(),
                pack.name(),
                pack.stickerType().getValue(),
                pack.operatorId(),
                pack.integrityTag(),
                pack.emotes().stream().map(e -> new JsonPack.JsonEmote(e.emoji(), e.fileId())).toList());
    }
}
