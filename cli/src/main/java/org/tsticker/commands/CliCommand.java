package org.tsticker.commands;

public interface CliCommand extends Command, SubparserAttacher {}
