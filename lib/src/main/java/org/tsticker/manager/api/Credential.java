package org.tsticker.manager.api;

/**
 * A credential whose token was accepted by the remote service.
 */
public record Credential(CredentialCandidate candidate, OperatorIdentity operator) {

    public String token() {
        return candidate.token();
    }

    public String ownerId() {
        return candidate.ownerId();
    }
}
