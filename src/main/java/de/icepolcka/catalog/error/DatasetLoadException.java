package de.icepolcka.catalog.error;

import java.nio.file.Path;
import java.util.Map;

/**
 * The loader failed to materialize a dataset from its resolved files.
 */
public class DatasetLoadException extends CatalogException {

    private final Map<String, Path> paths;

    public DatasetLoadException(Map<String, Path> paths, Throwable cause) {
        super("Failed to load dataset from " + paths + ": " + cause.getMessage(), cause);
        this.paths = Map.copyOf(paths);
    }

    public Map<String, Path> paths() {
        return paths;
    }
}
