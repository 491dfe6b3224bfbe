package org.tsticker.manager.remote;

import org.tsticker.manager.api.RemoteCollection;

/**
 * Result of looking up a remote collection. A missing collection is a regular outcome, not an error.
 */
public sealed interface CollectionLookup {

    record Found(RemoteCollection collection) implements CollectionLookup {}

    record NotFound(String name) implements CollectionLookup {}

    static CollectionLookup found(RemoteCollection collection) {
        return new Found(collection);
    }

    static CollectionLookup notFound(String name) {
        return new NotFound(name);
    }
}
