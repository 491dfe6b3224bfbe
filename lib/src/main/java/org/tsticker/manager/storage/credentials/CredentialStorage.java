package org.tsticker.manager.storage.credentials;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CredentialStorage(
        @JsonProperty("token") String token,
        @JsonProperty("owner_id") String ownerId,
        @JsonProperty("proxy") String proxy
) {}
