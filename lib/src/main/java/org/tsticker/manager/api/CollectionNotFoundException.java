package org.tsticker.manager.api;

public class CollectionNotFoundException extends Exception {

    private final String collectionName;

    public CollectionNotFoundException(final String collectionName) {
        super("Sticker collection not found: " + collectionName);
        this.collectionName = collectionName;
    }

    public String getCollectionName() {
        return collectionName;
    }
}
