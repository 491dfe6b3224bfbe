package org.tsticker.output;

public sealed interface OutputWriter permits JsonWriter, PlainTextWriter {}
