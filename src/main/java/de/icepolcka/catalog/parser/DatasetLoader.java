package de.icepolcka.catalog.parser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Materializes a dataset from its files, keyed by role. Only ever called through a result handle.
 */
@FunctionalInterface
public interface DatasetLoader<D> {
    D load(Map<String, Path> resolvedPaths) throws IOException;
}
