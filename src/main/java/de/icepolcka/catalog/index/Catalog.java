package de.icepolcka.catalog.index;

import de.icepolcka.catalog.domain.Attribute;
import de.icepolcka.catalog.domain.DatasetRecord;
import de.icepolcka.catalog.domain.FileDescriptor;
import de.icepolcka.catalog.domain.FileKind;
import de.icepolcka.catalog.domain.FileRecord;
import de.icepolcka.catalog.domain.ParsedFile;
import de.icepolcka.catalog.domain.QueryFilter;
import de.icepolcka.catalog.domain.SyncSummary;
import de.icepolcka.catalog.domain.SyncSummary.Outcome;
import de.icepolcka.catalog.error.CatalogOpenException;
import de.icepolcka.catalog.error.DatasetNotFoundException;
import de.icepolcka.catalog.error.DuplicateDatasetException;
import de.icepolcka.catalog.error.SyncCancelledException;
import de.icepolcka.catalog.error.SyncException;
import de.icepolcka.catalog.product.ProductDefinition;
import de.icepolcka.catalog.product.ReferenceData;
import de.icepolcka.catalog.source.LocalFsSource;
import de.icepolcka.catalog.source.SourceProvider;
import de.icepolcka.catalog.store.CatalogStore;
import de.icepolcka.catalog.store.H2CatalogStore;
import de.icepolcka.catalog.store.StoreTransaction;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Time-indexed catalog of one data product.
 * Handles the main flow: walk → classify → dedupe → parse → link → commit, and serves
 * range, closest and latest queries over the committed result.
 *
 * <p>One sync runs at a time; queries run concurrently with each other and wait for a running sync.
 * A catalog owns its store and must be closed.
 */
public final class Catalog<D> implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(Catalog.class);

    private final ProductDefinition<D> product;
    private final Path rootDir;
    private final CatalogStore store;
    private final CatalogOptions options;
    private final SourceProvider source;
    private final Clock clock;
    private final DatasetLinker linker = new DatasetLinker();
    private final QueryEngine<D> queries;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile boolean closed;

    private Catalog(ProductDefinition<D> product, Path rootDir, CatalogStore store, CatalogOptions options,
                    SourceProvider source, Clock clock) {
        this.product = product;
        this.rootDir = rootDir;
        this.store = store;
        this.options = options;
        this.source = source;
        this.clock = clock;
        this.queries = new QueryEngine<>(store, product);
    }

    /**
     * Open the catalog of {@code product} backed by the H2 store at {@code storePath}.
     * The store is created and seeded with the product's reference data if it does not exist.
     */
    public static <D> Catalog<D> open(ProductDefinition<D> product, Path rootDir, Path storePath,
                                      CatalogOptions options) throws CatalogOpenException, SyncException {
        CatalogStore store = H2CatalogStore.open(storePath, product.name(), product.referenceData());
        return open(product, rootDir, store, options, new LocalFsSource(), Clock.systemUTC());
    }

    public static <D> Catalog<D> open(ProductDefinition<D> product, Path rootDir, CatalogStore store,
                                      CatalogOptions options) throws SyncException {
        return open(product, rootDir, store, options, new LocalFsSource(), Clock.systemUTC());
    }

    /**
     * Open over an already opened store. The catalog takes ownership of {@code store} and closes it
     * if the initial sync fails.
     */
    public static <D> Catalog<D> open(ProductDefinition<D> product, Path rootDir, CatalogStore store,
                                      CatalogOptions options, SourceProvider source, Clock clock)
            throws SyncException {
        if (!store.productName().equals(product.name())) {
            throw new IllegalArgumentException("Store of " + store.productName() + " cannot back "
                    + product.name());
        }
        Catalog<D> catalog = new Catalog<>(product, rootDir, store, options, source, clock);
        if (options.sync()) {
            try {
                catalog.sync();
            } catch (SyncException | RuntimeException e) {
                catalog.close();
                throw e;
            }
        }
        return catalog;
    }

    /**
     * Reconcile the index with the directory tree. Idempotent.
     */
    public SyncSummary sync() throws SyncException {
        return sync(() -> false);
    }

    /**
     * Sync that gives up, leaving the last committed state, once {@code deadline} has passed.
     */
    public SyncSummary sync(Instant deadline) throws SyncException {
        return sync(() -> !clock.instant().isBefore(deadline));
    }

    /**
     * Sync that checks {@code cancelRequested} (and the thread's interrupt flag) before each file.
     * A cancelled pass commits nothing.
     */
    public SyncSummary sync(BooleanSupplier cancelRequested) throws SyncException {
        ensureOpen();
        lock.writeLock().lock();
        try {
            ensureOpen();
            return runSync(cancelRequested);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private SyncSummary runSync(BooleanSupplier cancelRequested) throws SyncException {
        Instant checkedAt = clock.instant();
        SyncSummary.Tally tally = new SyncSummary.Tally();
        String current = null;

        LOG.infof("Starting sync of %s from %s (recheck: %s)", product.name(), rootDir, options.recheck());

        try (StoreTransaction tx = store.begin();
             Stream<FileDescriptor> files = source.list(rootDir, product.excludePatterns())) {
            Iterator<FileDescriptor> it = files.iterator();
            while (it.hasNext()) {
                FileDescriptor descriptor = it.next();
                current = descriptor.path().toString();
                if (cancelRequested.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                    throw new SyncCancelledException("Sync of " + product.name() + " cancelled at " + current);
                }
                tally.scanned();
                tally.record(process(tx, descriptor, checkedAt));
            }
            current = null;
            tx.commit();
        } catch (SyncException e) {
            SyncSummary partial = tally.abortedAt(current);
            LOG.errorf("Sync of %s aborted at %s, nothing committed: %s", product.name(), current, e.getMessage());
            throw e.withSummary(partial);
        } catch (IOException | RuntimeException e) {
            SyncSummary partial = tally.abortedAt(current);
            LOG.errorf(e, "Sync of %s failed at %s, nothing committed", product.name(), current);
            throw new SyncException("Sync of " + product.name() + " failed: " + e.getMessage(), e)
                    .withSummary(partial);
        }

        SyncSummary summary = tally.completed();
        LOG.infof("Sync of %s complete: %d scanned, %d accepted, %d refreshed, %d skipped, %d unrecognized, %d corrupt",
                product.name(), summary.scanned(), summary.accepted(), summary.refreshed(), summary.skipped(),
                summary.unrecognized(), summary.corrupt());
        return summary;
    }

    private Outcome process(StoreTransaction tx, FileDescriptor descriptor, Instant checkedAt)
            throws DuplicateDatasetException {
        String path = descriptor.path().toString();
        if (!descriptor.readable()) {
            LOG.warnf("Skipping unreadable entry: %s", path);
            return Outcome.SKIPPED;
        }

        Optional<FileKind> kind = product.classifier().classify(descriptor.fileName());
        if (kind.isEmpty()) {
            LOG.debugf("Not a valid %s data file: %s", product.name(), path);
            return Outcome.UNRECOGNIZED;
        }

        Optional<FileRecord> known = tx.findFile(path);
        if (known.isPresent()) {
            if (!options.recheck() || !known.get().isStale(descriptor.modifiedAt())) {
                return Outcome.SKIPPED;
            }
            LOG.infof("Re-parsing modified file: %s", path);
        } else {
            LOG.infof("Updating: %s", path);
        }

        return parseAndLink(tx, descriptor, kind.get(), checkedAt, known.isPresent());
    }

    private Outcome parseAndLink(StoreTransaction tx, FileDescriptor descriptor, FileKind kind, Instant checkedAt,
                                 boolean refresh) throws DuplicateDatasetException {
        String path = descriptor.path().toString();

        ParsedFile parsed;
        try {
            parsed = product.parser().parse(descriptor.path(), kind);
        } catch (IOException e) {
            LOG.warnf("Recording corrupt file %s: %s", path, e.getMessage());
            return markCorrupt(tx, descriptor, checkedAt, refresh);
        }

        Optional<Attribute> unknown = store.referenceData().firstUnknown(parsed.attributes());
        if (unknown.isPresent()) {
            LOG.warnf("Recording corrupt file %s: unknown %s %s", path, unknown.get().externalName(),
                    parsed.attributes().get(unknown.get()).orElse(null));
            return markCorrupt(tx, descriptor, checkedAt, refresh);
        }

        FileRecord record = new FileRecord(path, kind, descriptor.modifiedAt(), checkedAt);
        tx.upsertFile(record);
        if (refresh) {
            linker.release(tx, path, parsed.identityKey());
        }
        linker.attach(tx, parsed.identityKey(), parsed.role(), record, parsed.attributes());
        return refresh ? Outcome.REFRESHED : Outcome.ACCEPTED;
    }

    private Outcome markCorrupt(StoreTransaction tx, FileDescriptor descriptor, Instant checkedAt, boolean refresh) {
        String path = descriptor.path().toString();
        tx.upsertFile(new FileRecord(path, FileKind.CORRUPT, descriptor.modifiedAt(), checkedAt));
        if (refresh) {
            linker.release(tx, path, null);
        }
        return Outcome.CORRUPT;
    }

    public List<ResultHandle<D>> range(Instant start, Instant end) {
        return range(start, end, QueryFilter.NONE);
    }

    /**
     * Datasets with time in {@code [start, end]}, oldest first.
     */
    public List<ResultHandle<D>> range(Instant start, Instant end, QueryFilter filter) {
        lock.readLock().lock();
        try {
            ensureOpen();
            return queries.range(start, end, filter);
        } finally {
            lock.readLock().unlock();
        }
    }

    public ResultHandle<D> closest(Instant time) throws DatasetNotFoundException {
        return closest(time, QueryFilter.NONE);
    }

    /**
     * Dataset nearest to {@code time}; on a tie the earlier dataset is returned.
     */
    public ResultHandle<D> closest(Instant time, QueryFilter filter) throws DatasetNotFoundException {
        lock.readLock().lock();
        try {
            ensureOpen();
            return queries.closest(time, filter);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ResultHandle<D>> latest(int n) {
        return latest(n, QueryFilter.NONE);
    }

    /**
     * Up to {@code n} datasets, most recent first.
     */
    public List<ResultHandle<D>> latest(int n, QueryFilter filter) {
        lock.readLock().lock();
        try {
            ensureOpen();
            return queries.latest(n, filter);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<FileRecord> files() {
        lock.readLock().lock();
        try {
            ensureOpen();
            return store.files();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<DatasetRecord> datasets() {
        lock.readLock().lock();
        try {
            ensureOpen();
            return store.datasets();
        } finally {
            lock.readLock().unlock();
        }
    }

    public ReferenceData referenceData() {
        return store.referenceData();
    }

    public ProductDefinition<D> product() {
        return product;
    }

    public Path rootDir() {
        return rootDir;
    }

    public CatalogOptions options() {
        return options;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Release the store. Waits for a running sync. Handles obtained earlier stay valid.
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            store.close();
            LOG.debugf("Closed catalog %s", product.name());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Catalog " + product.name() + " is closed");
        }
    }
}
