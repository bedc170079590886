package de.icepolcka.catalog.index;

import de.icepolcka.catalog.domain.Attribute;
import de.icepolcka.catalog.domain.DatasetAttributes;
import de.icepolcka.catalog.domain.DatasetRecord;
import de.icepolcka.catalog.domain.FileDescriptor;
import de.icepolcka.catalog.domain.FileKind;
import de.icepolcka.catalog.domain.FileRecord;
import de.icepolcka.catalog.domain.IdentityKey;
import de.icepolcka.catalog.domain.SyncSummary;
import de.icepolcka.catalog.error.DuplicateDatasetException;
import de.icepolcka.catalog.error.SyncCancelledException;
import de.icepolcka.catalog.error.SyncException;
import de.icepolcka.catalog.fixtures.KeyValueLoader;
import de.icepolcka.catalog.fixtures.KeyValueParser;
import de.icepolcka.catalog.fixtures.TestClock;
import de.icepolcka.catalog.fixtures.TestProducts;
import de.icepolcka.catalog.product.ProductDefinition;
import de.icepolcka.catalog.product.ReferenceData;
import de.icepolcka.catalog.source.LocalFsSource;
import de.icepolcka.catalog.source.SourceProvider;
import de.icepolcka.catalog.store.CatalogStore;
import de.icepolcka.catalog.store.InMemoryCatalogStore;
import de.icepolcka.catalog.store.StoreTransaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Sync behaviour against the in-memory store. {@link H2CatalogSyncTest} runs the same cases on H2.
 */
class CatalogSyncTest {

    static final Instant T = Instant.parse("2019-07-01T12:00:00Z");
    static final Instant SYNC_TIME = Instant.parse("2024-01-01T00:00:00Z");

    protected Path tempDir;
    protected Path root;
    protected KeyValueParser parser;
    protected ProductDefinition<Map<String, String>> product;
    protected TestClock clock;

    private Catalog<Map<String, String>> catalog;

    @BeforeEach
    void setUp() throws IOException {
        tempDir = Files.createTempDirectory("catalog-sync-test");
        root = Files.createDirectories(tempDir.resolve("data"));
        parser = KeyValueParser.wrfIdentity();
        product = TestProducts.wrfLike(parser, new KeyValueLoader());
        clock = new TestClock(SYNC_TIME);
    }

    @AfterEach
    void tearDown() throws IOException {
        if (catalog != null) {
            catalog.close();
        }
        deleteRecursively(tempDir);
    }

    private CatalogStore memoryStore;

    /**
     * Open the store backing this test's catalogs. Calls after a close must see the earlier state.
     */
    protected CatalogStore newStore() throws Exception {
        if (memoryStore == null) {
            memoryStore = new InMemoryCatalogStore(TestProducts.NAME, ReferenceData.icepolcka());
        }
        return memoryStore;
    }

    private Catalog<Map<String, String>> open(CatalogOptions options) throws Exception {
        return open(options, newStore());
    }

    private Catalog<Map<String, String>> open(CatalogOptions options, CatalogStore store) throws Exception {
        catalog = Catalog.open(product, root, store, options, new LocalFsSource(), clock);
        return catalog;
    }

    @Test
    void emptyRootSyncsToNothing() throws Exception {
        Catalog<Map<String, String>> catalog = open(CatalogOptions.readOnly());

        SyncSummary summary = catalog.sync();

        assertEquals(SyncSummary.EMPTY, summary);
        assertTrue(catalog.files().isEmpty());
        assertTrue(catalog.datasets().isEmpty());
    }

    @Test
    void companionFilesOfOneTimeStepShareOneDataset() throws Exception {
        // wrfout sorts first here, clouds first in the second half
        TestProducts.write(root, "a/wrfout_d03_1", "time=" + T, "mp_id=8", "domain=Munich");
        TestProducts.write(root, "b/clouds_d03_1", "time=" + T, "mp_id=8", "domain=Munich");
        TestProducts.write(root, "a/clouds_d03_2", "time=" + T.plusSeconds(300), "mp_id=8", "domain=Munich");
        TestProducts.write(root, "b/wrfout_d03_2", "time=" + T.plusSeconds(300), "mp_id=8", "domain=Munich");

        Catalog<Map<String, String>> catalog = open(CatalogOptions.DEFAULT);

        List<DatasetRecord> datasets = catalog.datasets();
        assertEquals(2, datasets.size());
        for (DatasetRecord dataset : datasets) {
            assertEquals(Set.of("wrfout", "clouds"), dataset.roles().keySet());
        }
        assertEquals(4, catalog.files().size());
    }

    @Test
    void datasetsFromDifferentSchemesStayApart() throws Exception {
        TestProducts.write(root, "wrfout_8", "time=" + T, "mp_id=8", "domain=Munich");
        TestProducts.write(root, "wrfout_10", "time=" + T, "mp_id=10", "domain=Munich");

        Catalog<Map<String, String>> catalog = open(CatalogOptions.DEFAULT);

        assertEquals(2, catalog.datasets().size());
    }

    @Test
    void secondSyncWithoutChangesParsesNothing() throws Exception {
        TestProducts.write(root, "wrfout_1", "time=" + T, "mp_id=8", "domain=Munich");
        TestProducts.write(root, "clouds_1", "time=" + T, "mp_id=8", "domain=Munich");
        TestProducts.write(root, "wrfout_bad", "mp_id=8");
        Catalog<Map<String, String>> catalog = open(CatalogOptions.DEFAULT);
        List<FileRecord> files = catalog.files();
        List<DatasetRecord> datasets = catalog.datasets();
        parser.reset();

        clock.advance(Duration.ofHours(1));
        SyncSummary summary = catalog.sync();

        assertEquals(0, parser.calls());
        assertEquals(3, summary.skipped());
        assertEquals(0, summary.parsed());
        assertEquals(files, catalog.files());
        assertEquals(datasets, catalog.datasets());
    }

    @Test
    void unparseableFilesAreRecordedAsCorrupt() throws Exception {
        TestProducts.write(root, "wrfout_no_time", "mp_id=8");
        TestProducts.write(root, "wrfout_bad_domain", "time=" + T, "mp_id=8", "domain=Bavaria");
        TestProducts.write(root, "wrfout_bad_time", "time=yesterday");
        TestProducts.write(root, "wrfout_ok", "time=" + T, "mp_id=8", "domain=Munich");

        Catalog<Map<String, String>> catalog = open(CatalogOptions.readOnly());
        SyncSummary summary = catalog.sync();

        assertEquals(3, summary.corrupt());
        assertEquals(1, summary.accepted());
        assertFalse(summary.aborted());
        List<FileRecord> corrupt = catalog.files().stream().filter(FileRecord::isCorrupt).toList();
        assertEquals(3, corrupt.size());
        assertEquals(1, catalog.datasets().size());
        assertEquals(Map.of("wrfout", root.resolve("wrfout_ok").toString()), catalog.datasets().get(0).roles());
    }

    @Test
    void unrecognizedAndExcludedFilesAreNotRecorded() throws Exception {
        TestProducts.write(root, "namelist.input", "time=" + T);
        TestProducts.write(root, "wrfout_1.tmp", "time=" + T, "mp_id=8");
        TestProducts.write(root, "wrfout_1", "time=" + T, "mp_id=8", "domain=Munich");

        Catalog<Map<String, String>> catalog = open(CatalogOptions.readOnly());
        SyncSummary summary = catalog.sync();

        // The excluded file is never scanned
        assertEquals(2, summary.scanned());
        assertEquals(1, summary.unrecognized());
        assertEquals(1, summary.accepted());
        assertEquals(1, catalog.files().size());
        assertEquals(1, parser.calls());
    }

    @Test
    void modifiedFilesAreReparsedOnlyWithRecheck() throws Exception {
        Path file = TestProducts.write(root, "wrfout_1", "time=" + T, "mp_id=8", "domain=Munich", "source=sim");
        open(CatalogOptions.DEFAULT).close();

        // Content changes after the first sync
        TestProducts.write(root, "wrfout_1", "time=" + T, "mp_id=8", "domain=Munich", "source=obs");
        TestProducts.touch(file, SYNC_TIME.plus(Duration.ofDays(1)));
        clock.advance(Duration.ofDays(2));

        parser.reset();
        Catalog<Map<String, String>> trusting = open(CatalogOptions.DEFAULT);
        assertEquals(0, parser.calls());
        assertEquals("sim", trusting.datasets().get(0).attributes().source());
        trusting.close();

        Catalog<Map<String, String>> rechecking = open(new CatalogOptions(false, true));
        SyncSummary refreshed = rechecking.sync();
        assertEquals(1, refreshed.refreshed());
        assertEquals(1, rechecking.datasets().size());
        assertEquals("obs", rechecking.datasets().get(0).attributes().source());
        assertEquals(clock.instant(), rechecking.files().get(0).lastChecked());

        // The watermark moved past the modification time
        parser.reset();
        rechecking.sync();
        assertEquals(0, parser.calls());
    }

    @Test
    void reparsedFileWithNewIdentityLeavesItsOldDataset() throws Exception {
        Path wrfout = TestProducts.write(root, "wrfout_1", "time=" + T, "mp_id=8", "domain=Munich");
        TestProducts.write(root, "clouds_1", "time=" + T, "mp_id=8", "domain=Munich");
        Catalog<Map<String, String>> catalog = open(new CatalogOptions(true, true));
        assertEquals(1, catalog.datasets().size());

        TestProducts.write(root, "wrfout_1", "time=" + T, "mp_id=10", "domain=Munich");
        TestProducts.touch(wrfout, SYNC_TIME.plusSeconds(60));
        clock.advance(Duration.ofMinutes(5));
        catalog.sync();

        Map<Integer, DatasetRecord> byScheme = catalog.datasets().stream()
                .collect(Collectors.toMap(d -> d.attributes().parameterId(), d -> d));
        assertEquals(2, byScheme.size());
        assertEquals(Set.of("clouds"), byScheme.get(8).roles().keySet());
        assertEquals(Map.of("wrfout", wrfout.toString()), byScheme.get(10).roles());
    }

    @Test
    void fileThatTurnsCorruptIsDetachedFromItsDataset() throws Exception {
        Path wrfout = TestProducts.write(root, "wrfout_1", "time=" + T, "mp_id=8", "domain=Munich");
        TestProducts.write(root, "clouds_1", "time=" + T, "mp_id=8", "domain=Munich");
        Catalog<Map<String, String>> catalog = open(new CatalogOptions(true, true));

        TestProducts.write(root, "wrfout_1", "truncated");
        TestProducts.touch(wrfout, SYNC_TIME.plusSeconds(60));
        clock.advance(Duration.ofMinutes(5));
        SyncSummary summary = catalog.sync();

        assertEquals(1, summary.corrupt());
        assertTrue(catalog.files().stream().anyMatch(f -> f.path().equals(wrfout.toString()) && f.isCorrupt()));
        assertEquals(Set.of("clouds"), catalog.datasets().get(0).roles().keySet());
    }

    @Test
    void sameRoleFromANewPathReplacesTheOldOne() throws Exception {
        TestProducts.write(root, "run1/wrfout_1", "time=" + T, "mp_id=8", "domain=Munich");
        Catalog<Map<String, String>> catalog = open(CatalogOptions.DEFAULT);

        Path moved = TestProducts.write(root, "run2/wrfout_1", "time=" + T, "mp_id=8", "domain=Munich");
        SyncSummary summary = catalog.sync();

        assertEquals(1, summary.accepted());
        assertEquals(1, catalog.datasets().size());
        assertEquals(Map.of("wrfout", moved.toString()), catalog.datasets().get(0).roles());
        assertEquals(2, catalog.files().size());
    }

    @Test
    void duplicateDatasetsAbortTheSyncWithoutCommitting() throws Exception {
        DatasetAttributes attributes = DatasetAttributes.at(T).parameterId(8).domain("Munich").build();
        IdentityKey key = IdentityKey.of(attributes, Attribute.TIME, Attribute.END_TIME,
                Attribute.PARAMETER_ID, Attribute.DOMAIN);
        CatalogStore store = newStore();
        try (StoreTransaction tx = store.begin()) {
            FileRecord seeded = new FileRecord(root.resolve("old/wrfout_x").toString(), new FileKind("wrfout"),
                    TestProducts.OLD_MTIME, SYNC_TIME);
            tx.upsertFile(seeded);
            tx.insertDataset(DatasetRecord.create(key, "wrfout", seeded.path(), attributes));
            tx.insertDataset(DatasetRecord.create(key, "wrfout", seeded.path(), attributes));
            tx.commit();
        }
        TestProducts.write(root, "clouds_ok", "time=" + T.plusSeconds(300), "mp_id=8", "domain=Munich");
        Path duplicate = TestProducts.write(root, "wrfout_dup", "time=" + T, "mp_id=8", "domain=Munich");

        Catalog<Map<String, String>> catalog = open(CatalogOptions.readOnly(), store);
        DuplicateDatasetException e = assertThrows(DuplicateDatasetException.class, catalog::sync);

        assertEquals(key, e.identityKey());
        assertEquals(2, e.matches());
        assertEquals(duplicate.toString(), e.failedPath());
        assertEquals(1, e.summary().accepted());
        assertTrue(e.summary().aborted());
        // Nothing from the aborted pass is visible
        assertEquals(1, catalog.files().size());
        assertEquals(2, catalog.datasets().size());
        assertTrue(catalog.datasets().stream().allMatch(d -> d.identityKey().equals(key)));
    }

    @Test
    void cancelledSyncCommitsNothing() throws Exception {
        TestProducts.write(root, "wrfout_1", "time=" + T, "mp_id=8", "domain=Munich");
        TestProducts.write(root, "wrfout_2", "time=" + T.plusSeconds(300), "mp_id=8", "domain=Munich");
        TestProducts.write(root, "wrfout_3", "time=" + T.plusSeconds(600), "mp_id=8", "domain=Munich");
        Catalog<Map<String, String>> catalog = open(CatalogOptions.readOnly());

        AtomicInteger checks = new AtomicInteger();
        SyncCancelledException e = assertThrows(SyncCancelledException.class,
                () -> catalog.sync(() -> checks.incrementAndGet() > 2));

        assertEquals(2, e.summary().scanned());
        assertEquals(root.resolve("wrfout_3").toString(), e.failedPath());
        assertTrue(catalog.files().isEmpty());
        assertTrue(catalog.datasets().isEmpty());

        // A later pass picks up where nothing was left
        assertEquals(3, catalog.sync().accepted());
    }

    @Test
    void syncPastItsDeadlineIsCancelled() throws Exception {
        TestProducts.write(root, "wrfout_1", "time=" + T, "mp_id=8", "domain=Munich");
        Catalog<Map<String, String>> catalog = open(CatalogOptions.readOnly());

        assertThrows(SyncCancelledException.class, () -> catalog.sync(clock.instant()));
        assertTrue(catalog.files().isEmpty());
        assertEquals(1, catalog.sync(clock.instant().plusSeconds(60)).accepted());
    }

    @Test
    void missingRootFailsTheOpeningSync() throws Exception {
        deleteRecursively(root);

        SyncException e = assertThrows(SyncException.class, () -> open(CatalogOptions.DEFAULT));
        assertTrue(e.getCause() instanceof IOException);
    }

    @Test
    void unreadableEntriesAreSkippedWithoutFailingTheSync() throws Exception {
        TestProducts.write(root, "wrfout_1", "time=" + T, "mp_id=8", "domain=Munich");
        Path locked = root.resolve("locked");
        SourceProvider withLockedDirectory = (dir, excludes) -> Stream.concat(
                new LocalFsSource().list(dir, excludes), Stream.of(FileDescriptor.unreadable(locked)));
        catalog = Catalog.open(product, root, newStore(), CatalogOptions.readOnly(), withLockedDirectory, clock);

        SyncSummary summary = catalog.sync();

        assertFalse(summary.aborted());
        assertEquals(2, summary.scanned());
        assertEquals(1, summary.accepted());
        assertEquals(1, summary.skipped());
        assertEquals(1, catalog.datasets().size());
        assertTrue(catalog.files().stream().noneMatch(f -> f.path().equals(locked.toString())));
    }

    @Test
    void storeOfAnotherProductIsRejected() {
        CatalogStore foreign = new InMemoryCatalogStore("OTHER", ReferenceData.icepolcka());

        assertThrows(IllegalArgumentException.class, () -> Catalog.open(product, root, foreign,
                CatalogOptions.readOnly(), new LocalFsSource(), clock));
    }

    @Test
    void closedCatalogRefusesWork() throws Exception {
        Catalog<Map<String, String>> catalog = open(CatalogOptions.readOnly());
        catalog.close();
        catalog.close();

        assertTrue(catalog.isClosed());
        assertThrows(IllegalStateException.class, catalog::sync);
        assertThrows(IllegalStateException.class, () -> catalog.latest(1));
        assertThrows(IllegalStateException.class, catalog::files);
    }

    @Test
    void repeatedSyncsKeepOneDatasetPerIdentity() throws Exception {
        Catalog<Map<String, String>> catalog = open(new CatalogOptions(false, true));
        for (int round = 0; round < 3; round++) {
            for (int step = 0; step < 4; step++) {
                Instant time = T.plusSeconds(300L * step);
                TestProducts.write(root, "r" + round + "/wrfout_" + step, "time=" + time, "mp_id=8", "domain=Munich");
                TestProducts.write(root, "r" + round + "/clouds_" + step, "time=" + time, "mp_id=8", "domain=Munich");
            }
            clock.advance(Duration.ofMinutes(1));
            catalog.sync();
        }

        List<DatasetRecord> datasets = catalog.datasets();
        assertEquals(4, datasets.size());
        assertEquals(4, datasets.stream().map(DatasetRecord::identityKey).distinct().count());
        assertEquals(24, catalog.files().size());
    }

    static void deleteRecursively(Path path) throws IOException {
        if (path != null && Files.exists(path)) {
            try (Stream<Path> walk = Files.walk(path)) {
                walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                    try {
                        Files.delete(p);
                    } catch (IOException e) {
                        // Ignore
                    }
                });
            }
        }
    }
}
