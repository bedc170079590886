package de.icepolcka.catalog.store;

import de.icepolcka.catalog.domain.DatasetRecord;
import de.icepolcka.catalog.domain.FileRecord;
import de.icepolcka.catalog.domain.IdentityKey;
import de.icepolcka.catalog.domain.QueryFilter;
import de.icepolcka.catalog.product.RangeMode;
import de.icepolcka.catalog.product.ReferenceData;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Simple in-memory store for development/testing.
 * Not persistent - state is lost when the store is closed.
 *
 * <p>A transaction works on private copies of the maps and publishes them on commit,
 * so readers always see the last committed snapshot.
 */
public class InMemoryCatalogStore implements CatalogStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCatalogStore.class);

    private static final Comparator<DatasetRecord> BY_TIME =
            Comparator.comparing(DatasetRecord::time).thenComparingLong(DatasetRecord::id);

    private final String productName;
    private final ReferenceData referenceData;

    private volatile Snapshot committed = new Snapshot(new TreeMap<>(), new TreeMap<>(), 1L);

    public InMemoryCatalogStore(String productName, ReferenceData referenceData) {
        this.productName = productName;
        this.referenceData = referenceData;
    }

    @Override
    public String productName() {
        return productName;
    }

    @Override
    public ReferenceData referenceData() {
        return referenceData;
    }

    @Override
    public StoreTransaction begin() {
        return new InMemoryTransaction(committed);
    }

    @Override
    public Optional<FileRecord> findFile(String path) {
        return Optional.ofNullable(committed.files.get(path));
    }

    @Override
    public List<FileRecord> files() {
        return List.copyOf(committed.files.values());
    }

    @Override
    public List<DatasetRecord> datasets() {
        return List.copyOf(committed.datasets.values());
    }

    @Override
    public List<DatasetRecord> range(Instant start, Instant end, RangeMode mode, QueryFilter filter) {
        return filtered(filter)
                .filter(d -> !d.time().isBefore(start) && !d.time().isAfter(end))
                .filter(d -> mode != RangeMode.CONTAINED || !d.attributes().effectiveEndTime().isAfter(end))
                .sorted(BY_TIME)
                .toList();
    }

    @Override
    public Optional<DatasetRecord> latestAtOrBefore(Instant time, QueryFilter filter) {
        return filtered(filter)
                .filter(d -> !d.time().isAfter(time))
                .max(BY_TIME);
    }

    @Override
    public Optional<DatasetRecord> earliestAfter(Instant time, QueryFilter filter) {
        return filtered(filter)
                .filter(d -> d.time().isAfter(time))
                .min(BY_TIME);
    }

    @Override
    public List<DatasetRecord> latest(int limit, QueryFilter filter) {
        return filtered(filter)
                .sorted(BY_TIME.reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public void close() {
        LOG.debugf("Discarding in-memory store for %s", productName);
    }

    private Stream<DatasetRecord> filtered(QueryFilter filter) {
        return committed.datasets.values().stream()
                .filter(d -> filter.matches(d.attributes()));
    }

    private record Snapshot(Map<String, FileRecord> files, Map<Long, DatasetRecord> datasets, long nextId) {
    }

    private final class InMemoryTransaction implements StoreTransaction {

        private final Map<String, FileRecord> files;
        private final Map<Long, DatasetRecord> datasets;
        private long nextId;
        private boolean done;

        private InMemoryTransaction(Snapshot base) {
            this.files = new TreeMap<>(base.files);
            this.datasets = new TreeMap<>(base.datasets);
            this.nextId = base.nextId;
        }

        @Override
        public Optional<FileRecord> findFile(String path) {
            return Optional.ofNullable(files.get(path));
        }

        @Override
        public void upsertFile(FileRecord record) {
            files.put(record.path(), record);
        }

        @Override
        public List<DatasetRecord> findByIdentity(IdentityKey identityKey) {
            return datasets.values().stream()
                    .filter(d -> d.identityKey().equals(identityKey))
                    .toList();
        }

        @Override
        public List<DatasetRecord> findByPath(String path) {
            return datasets.values().stream()
                    .filter(d -> d.roles().containsValue(path))
                    .toList();
        }

        @Override
        public DatasetRecord insertDataset(DatasetRecord record) {
            DatasetRecord saved = record.withId(nextId++);
            datasets.put(saved.id(), saved);
            return saved;
        }

        @Override
        public void updateDataset(DatasetRecord record) {
            if (!datasets.containsKey(record.id())) {
                throw new IllegalArgumentException("Dataset not found: " + record.id());
            }
            datasets.put(record.id(), record);
        }

        @Override
        public void commit() {
            if (done) {
                throw new IllegalStateException("Transaction already finished");
            }
            committed = new Snapshot(new TreeMap<>(files), new TreeMap<>(datasets), nextId);
            done = true;
        }

        @Override
        public void close() {
            if (!done) {
                LOG.debugf("Rolling back uncommitted changes for %s", productName);
                done = true;
            }
        }
    }
}
