package org.tsticker.manager.api;

/**
 * Syntactically valid, not yet authenticated credential.
 */
public record CredentialCandidate(String token, String ownerId, String proxy) {

    @Override
    public String toString() {
        return "CredentialCandidate[ownerId=" + ownerId + ", proxy=" + proxy + "]";
    }

    public static CredentialCandidate parse(
            final String token, final String ownerId, final String proxy
    ) throws InvalidCredentialException {
        if (token == null || token.isBlank()) {
            throw new InvalidCredentialException("Missing bot token");
        }
        if (ownerId == null) {
            throw new InvalidCredentialException("Missing owner id");
        }
        try {
            Long.parseLong(ownerId.trim());
        } catch (NumberFormatException e) {
            throw new InvalidCredentialException("Invalid owner id: " + ownerId);
        }
        return new CredentialCandidate(token.trim(), ownerId.trim(), normalizeProxy(proxy));
    }

    private static String normalizeProxy(final String proxy) {
        if (proxy == null || proxy.isBlank()) {
            return null;
        }
        // let the proxy resolve host names
        if (proxy.startsWith("socks5://")) {
            return "socks5h://" + proxy.substring("socks5://".length());
        }
        return proxy;
    }
}
