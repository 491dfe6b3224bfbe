package org.tsticker.manager.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CredentialCandidateTest {

    @Test
    void socksProxyResolvesRemotely() throws Exception {
        final var candidate = CredentialCandidate.parse("1:a", "5", "socks5://127.0.0.1:1080");

        assertEquals("socks5h://127.0.0.1:1080", candidate.proxy());
    }

    @ParameterizedTest
    @ValueSource(strings = {"http://proxy:8080", "socks5h://proxy:1080"})
    void otherProxiesAreKept(final String proxy) throws Exception {
        assertEquals(proxy, CredentialCandidate.parse("1:a", "5", proxy).proxy());
    }

    @Test
    void blankProxyMeansDirect() throws Exception {
        assertNull(CredentialCandidate.parse("1:a", "5", " ").proxy());
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "12a", "", "1.5"})
    void ownerIdMustBeInteger(final String ownerId) {
        assertThrows(InvalidCredentialException.class, () -> CredentialCandidate.parse("1:a", ownerId, null));
    }

    @ParameterizedTest
    @NullAndEmptySource
    void tokenIsRequired(final String token) {
        assertThrows(InvalidCredentialException.class, () -> CredentialCandidate.parse(token, "5", null));
    }

    @Test
    void toStringHidesToken() throws Exception {
        final var candidate = CredentialCandidate.parse("123:secret", "5", null);

        assertFalse(candidate.toString().contains("secret"));
    }
}
