package org.tsticker.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tsticker.manager.api.AppInitException;
import org.tsticker.manager.api.Credential;
import org.tsticker.manager.api.CredentialCandidate;
import org.tsticker.manager.api.InvalidCredentialException;
import org.tsticker.manager.api.NotLoggedInException;
import org.tsticker.manager.api.OperatorIdentity;
import org.tsticker.manager.api.RemoteFailureException;
import org.tsticker.manager.encoder.StickerEncoder;
import org.tsticker.manager.helper.Context;
import org.tsticker.manager.internal.ManagerImpl;
import org.tsticker.manager.internal.RateLimiter;
import org.tsticker.manager.internal.RemoteCallExecutor;
import org.tsticker.manager.remote.RemoteClientFactory;
import org.tsticker.manager.storage.credentials.CredentialStore;

import java.io.File;
import java.io.IOException;

/**
 * Entry point of the library: manages the stored credential and creates authenticated {@link Manager}s.
 */
public class StickerAccountFiles {

    private static final Logger logger = LoggerFactory.getLogger(StickerAccountFiles.class);

    private final Settings settings;
    private final CredentialStore credentialStore;
    private final RemoteClientFactory remoteClientFactory;
    private final StickerEncoder stickerEncoder;

    /**
     * @param remoteClientFactory null if no remote client implementation is available, then only {@link #logout()}
     *                            works
     */
    public StickerAccountFiles(
            final File configPath,
            final Settings settings,
            final RemoteClientFactory remoteClientFactory,
            final StickerEncoder stickerEncoder
    ) {
        this.settings = settings;
        this.credentialStore = new CredentialStore(configPath);
        this.remoteClientFactory = remoteClientFactory;
        this.stickerEncoder = stickerEncoder;
    }

    /**
     * Validates the token against the remote service and stores the credential.
     */
    public Credential login(
            final String token, final String ownerId, final String proxy
    ) throws InvalidCredentialException, AppInitException, IOException {
        final var candidate = CredentialCandidate.parse(token, ownerId, proxy);
        try (var manager = initManager(candidate)) {
            credentialStore.save(candidate);
            final var credential = manager.getCredential();
            logger.info("Logged in as {} ({})", credential.operator().username(), credential.operator().id());
            return credential;
        }
    }

    /**
     * @return false if there was no stored credential
     */
    public boolean logout() throws IOException {
        return credentialStore.delete();
    }

    public Manager initManager() throws NotLoggedInException, AppInitException, IOException {
        final var candidate = credentialStore.load().orElseThrow(NotLoggedInException::new);
        return initManager(candidate);
    }

    private Manager initManager(final CredentialCandidate candidate) throws AppInitException {
        if (remoteClientFactory == null) {
            throw new AppInitException("No remote client implementation available");
        }
        final var client = remoteClientFactory.create(candidate.token(), candidate.proxy());
        final var rateLimiter = new RateLimiter(settings.maxConcurrentRequests(), settings.requestInterval());
        final var executor = new RemoteCallExecutor(rateLimiter, settings.readRetries());

        final OperatorIdentity operator;
        try {
            operator = executor.executeRead("get operator", client::getOperator);
        } catch (RemoteFailureException e) {
            executor.close();
            client.close();
            throw new AppInitException("Failed to validate the bot token: " + e.getMessage(), e);
        }
        logger.debug("Authenticated as {} ({})", operator.username(), operator.id());

        final var credential = new Credential(candidate, operator);
        return new ManagerImpl(new Context(credential, client, executor, stickerEncoder, settings));
    }
}
