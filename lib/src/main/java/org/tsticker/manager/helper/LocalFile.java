package org.tsticker.manager.helper;

import java.nio.file.Path;

/**
 * @param contentKey file name without extension, equal to the remote unique id for downloaded stickers
 */
public record LocalFile(String contentKey, long byteSize, Path path) {}
