package org.tsticker.manager.api;

public class NotLoggedInException extends Exception {

    public NotLoggedInException() {
        super("You are not logged in. Please login first.");
    }
}
