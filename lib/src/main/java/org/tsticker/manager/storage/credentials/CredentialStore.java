package org.tsticker.manager.storage.credentials;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsticker.manager.api.CredentialCandidate;
import org.tsticker.manager.api.InvalidCredentialException;
import org.tsticker.manager.storage.Utils;
import org.tsticker.manager.util.IOUtils;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Optional;

/**
 * Stores the single bot credential in a file only readable by the current user.
 */
public class CredentialStore {

    private final static Logger logger = LoggerFactory.getLogger(CredentialStore.class);

    private final ObjectMapper objectMapper = Utils.createStorageObjectMapper();
    private final File configPath;

    public CredentialStore(final File configPath) {
        this.configPath = configPath;
    }

    public Optional<CredentialCandidate> load() throws IOException {
        final var file = getCredentialFile();
        if (!file.exists()) {
            return Optional.empty();
        }
        final var storage = objectMapper.readValue(file, CredentialStorage.class);
        if (storage == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(CredentialCandidate.parse(storage.token(), storage.ownerId(), storage.proxy()));
        } catch (InvalidCredentialException e) {
            throw new IOException("Stored credential in " + file + " is invalid: " + e.getMessage(), e);
        }
    }

    public void save(final CredentialCandidate candidate) throws IOException {
        IOUtils.createPrivateDirectories(configPath);
        final var file = getCredentialFile();
        if (!file.exists()) {
            IOUtils.createPrivateFile(file);
        }
        final var storage = new CredentialStorage(candidate.token(), candidate.ownerId(), candidate.proxy());
        try (var output = new ByteArrayOutputStream()) {
            objectMapper.writeValue(output, storage);
            Files.write(file.toPath(), output.toByteArray());
        }
        logger.debug("Saved credential for owner {}", candidate.ownerId());
    }

    /**
     * @return false if no credential was stored
     */
    public boolean delete() throws IOException {
        return Files.deleteIfExists(getCredentialFile().toPath());
    }

    private File getCredentialFile() {
        return new File(configPath, "credentials.json");
    }
}
