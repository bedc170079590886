package de.icepolcka.catalog.index;

import de.icepolcka.catalog.domain.Attribute;
import de.icepolcka.catalog.domain.DatasetAttributes;
import de.icepolcka.catalog.domain.DatasetRecord;
import de.icepolcka.catalog.error.DatasetLoadException;
import de.icepolcka.catalog.parser.DatasetLoader;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Query result that has not paid for I/O yet. Holds a snapshot of the dataset's attributes
 * and file paths taken at query time; {@link #load()} hands the paths to the product's loader.
 *
 * <p>Handles keep no reference to the catalog and stay usable after it is closed.
 * Nothing guarantees the files still exist when {@code load()} is called.
 */
public final class ResultHandle<D> {

    private final long datasetId;
    private final DatasetAttributes attributes;
    private final Map<String, Path> paths;
    private final DatasetLoader<D> loader;

    ResultHandle(long datasetId, DatasetAttributes attributes, Map<String, Path> paths, DatasetLoader<D> loader) {
        this.datasetId = datasetId;
        this.attributes = attributes;
        this.paths = Map.copyOf(paths);
        this.loader = loader;
    }

    static <D> ResultHandle<D> of(DatasetRecord record, DatasetLoader<D> loader) {
        Map<String, Path> paths = new TreeMap<>();
        record.roles().forEach((role, path) -> paths.put(role, Path.of(path)));
        return new ResultHandle<>(record.id(), record.attributes(), paths, loader);
    }

    public long datasetId() {
        return datasetId;
    }

    public Instant time() {
        return attributes.time();
    }

    public DatasetAttributes attributes() {
        return attributes;
    }

    public Optional<Object> attribute(Attribute attribute) {
        return attributes.get(attribute);
    }

    /**
     * Attribute by external name ({@code time}, {@code mp_id}, {@code radar}, ...).
     * Empty for unknown names and unset attributes.
     */
    public Optional<Object> attribute(String name) {
        return Attribute.byExternalName(name).flatMap(attributes::get);
    }

    public Set<String> roles() {
        return new TreeMap<>(paths).keySet();
    }

    public Map<String, Path> paths() {
        return paths;
    }

    public Optional<Path> path(String role) {
        return Optional.ofNullable(paths.get(role));
    }

    /**
     * Handle restricted to the file of one role, or empty if the dataset has no such file.
     */
    public Optional<ResultHandle<D>> forRole(String role) {
        Path path = paths.get(role);
        if (path == null) {
            return Optional.empty();
        }
        return Optional.of(new ResultHandle<>(datasetId, attributes, Map.of(role, path), loader));
    }

    /**
     * Materialize the dataset through the loader.
     */
    public D load() throws DatasetLoadException {
        try {
            return loader.load(paths);
        } catch (Exception e) {
            throw new DatasetLoadException(paths, e);
        }
    }

    @Override
    public String toString() {
        return "ResultHandle{dataset=" + datasetId + ", time=" + attributes.time() + ", roles=" + roles() + "}";
    }
}
