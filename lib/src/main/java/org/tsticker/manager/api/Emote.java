package org.tsticker.manager.api;

public record Emote(String emoji, String fileId) {}
