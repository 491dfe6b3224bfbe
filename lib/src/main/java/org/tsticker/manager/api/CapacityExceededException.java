package org.tsticker.manager.api;

public class CapacityExceededException extends Exception {

    private final int resultingSize;
    private final int limit;

    public CapacityExceededException(final int resultingSize, final int limit) {
        super("The requested changes would grow the collection to "
                + resultingSize
                + " stickers, exceeding the limit of "
                + limit);
        this.resultingSize = resultingSize;
        this.limit = limit;
    }

    public int getResultingSize() {
        return resultingSize;
    }

    public int getLimit() {
        return limit;
    }
}
