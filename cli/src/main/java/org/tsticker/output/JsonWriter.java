package org.tsticker.output;

public non-sealed interface JsonWriter extends OutputWriter {

    void write(Object object);
}
