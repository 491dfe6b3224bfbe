package org.tsticker.manager.storage.credentials;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tsticker.manager.api.CredentialCandidate;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CredentialStoreTest {

    @TempDir
    Path configDir;

    @Test
    void storesAndDeletesCredential() throws Exception {
        final var store = new CredentialStore(configDir.resolve("tsticker").toFile());
        assertTrue(store.load().isEmpty());

        final var candidate = CredentialCandidate.parse("123:abc", "777", "socks5://localhost:1080");
        store.save(candidate);

        assertEquals(candidate, store.load().orElseThrow());
        assertTrue(store.delete());
        assertTrue(store.load().isEmpty());
        assertFalse(store.delete());
    }

    @Test
    void overwritesExistingCredential() throws Exception {
        final var store = new CredentialStore(configDir.toFile());
        store.save(CredentialCandidate.parse("1:a", "1", null));
        store.save(CredentialCandidate.parse("2:b", "2", null));

        assertEquals("2:b", store.load().orElseThrow().token());
    }
}
