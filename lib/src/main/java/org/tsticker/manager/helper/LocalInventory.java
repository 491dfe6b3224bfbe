package org.tsticker.manager.helper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lists the sticker files of a pack directory.
 */
public class LocalInventory {

    private final static Logger logger = LoggerFactory.getLogger(LocalInventory.class);

    private final Path stickersPath;

    public LocalInventory(final Path stickersPath) {
        this.stickersPath = stickersPath;
    }

    /**
     * Scans the sticker directory. Files sharing a stem are duplicates, only the lexicographically first file
     * name is kept and the others are deleted.
     *
     * @return the remaining files ordered by content key
     */
    public List<LocalFile> scan() throws IOException {
        final List<Path> files;
        try (var stream = Files.list(stickersPath)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }

        final Map<String, LocalFile> byKey = new TreeMap<>();
        for (var file : files) {
            final var key = stem(file);
            if (byKey.containsKey(key)) {
                logger.info("Deleting duplicate file {}", file.getFileName());
                Files.delete(file);
                continue;
            }
            byKey.put(key, new LocalFile(key, Files.size(file), file));
        }
        return new ArrayList<>(byKey.values());
    }

    static String stem(final Path file) {
        final var name = file.getFileName().toString();
        final var dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
