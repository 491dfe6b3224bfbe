package org.tsticker.manager.remote;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Service provider creating {@link RemoteClient} instances, registered in
 * {@code META-INF/services/org.tsticker.manager.remote.RemoteClientFactory}.
 */
public interface RemoteClientFactory {

    /**
     * @param proxy proxy url or null for a direct connection
     */
    RemoteClient create(String token, String proxy);

    static Optional<RemoteClientFactory> load() {
        return ServiceLoader.load(RemoteClientFactory.class).findFirst();
    }
}
