package org.tsticker.manager.api;

/**
 * The remote account (bot) that performs all mutations.
 */
public record OperatorIdentity(String id, String username) {}
