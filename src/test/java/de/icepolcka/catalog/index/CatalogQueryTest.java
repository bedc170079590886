package de.icepolcka.catalog.index;

import de.icepolcka.catalog.domain.DatasetAttributes;
import de.icepolcka.catalog.domain.DatasetRecord;
import de.icepolcka.catalog.domain.FileKind;
import de.icepolcka.catalog.domain.FileRecord;
import de.icepolcka.catalog.domain.IdentityKey;
import de.icepolcka.catalog.domain.QueryFilter;
import de.icepolcka.catalog.error.DatasetNotFoundException;
import de.icepolcka.catalog.fixtures.KeyValueLoader;
import de.icepolcka.catalog.fixtures.KeyValueParser;
import de.icepolcka.catalog.fixtures.TestProducts;
import de.icepolcka.catalog.parser.KindRule;
import de.icepolcka.catalog.product.ProductDefinition;
import de.icepolcka.catalog.product.RangeMode;
import de.icepolcka.catalog.product.ReferenceData;
import de.icepolcka.catalog.store.CatalogStore;
import de.icepolcka.catalog.store.InMemoryCatalogStore;
import de.icepolcka.catalog.store.StoreTransaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CatalogQueryTest {

    private static final Instant NOON = Instant.parse("2019-07-01T12:00:00Z");
    private static final Instant FIVE_TO = Instant.parse("2019-07-01T11:55:00Z");
    private static final Instant CHECKED = Instant.parse("2024-01-01T00:00:00Z");

    private CatalogStore store;
    private Catalog<Map<String, String>> catalog;
    private int counter;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryCatalogStore(TestProducts.NAME, ReferenceData.icepolcka());
        catalog = Catalog.open(TestProducts.wrfLike(), Path.of("unused"), store, CatalogOptions.readOnly());
    }

    @AfterEach
    void tearDown() {
        catalog.close();
    }

    @Test
    void closestPrefersTheNearerLaterDataset() throws Exception {
        seed(FIVE_TO);
        seed(NOON);

        assertEquals(NOON, catalog.closest(Instant.parse("2019-07-01T11:58:00Z")).time());
    }

    @Test
    void closestResolvesExactTiesToTheEarlierDataset() throws Exception {
        seed(FIVE_TO);
        seed(NOON);

        assertEquals(FIVE_TO, catalog.closest(Instant.parse("2019-07-01T11:57:30Z")).time());
    }

    @Test
    void closestReturnsAnExactMatch() throws Exception {
        seed(FIVE_TO);
        seed(NOON);

        assertEquals(NOON, catalog.closest(NOON).time());
        assertEquals(FIVE_TO, catalog.closest(FIVE_TO).time());
    }

    @Test
    void closestFallsBackToTheOnlyNonEmptySide() throws Exception {
        seed(NOON);

        assertEquals(NOON, catalog.closest(NOON.minus(Duration.ofDays(30))).time());
        assertEquals(NOON, catalog.closest(NOON.plus(Duration.ofDays(30))).time());
    }

    @Test
    void closestOnNothingIsNotFound() throws Exception {
        assertThrows(DatasetNotFoundException.class, () -> catalog.closest(NOON));

        seed(NOON, b -> b.parameterId(8));
        QueryFilter morrison = QueryFilter.builder().parameterId(10).build();
        assertThrows(DatasetNotFoundException.class, () -> catalog.closest(NOON, morrison));
    }

    @Test
    void closestMinimizesDistanceForAnyQueryTime() throws Exception {
        List<Instant> times = List.of(
                NOON,
                NOON.plusSeconds(300),
                NOON.plusSeconds(310),
                NOON.plusSeconds(900),
                NOON.plusSeconds(3600));
        times.forEach(this::seed);

        for (long offset = -120; offset <= 3720; offset += 5) {
            Instant t = NOON.plusSeconds(offset);
            Instant expected = times.stream()
                    .min(Comparator.comparing((Instant x) -> Duration.between(x, t).abs())
                            .thenComparing(Comparator.naturalOrder()))
                    .orElseThrow();
            assertEquals(expected, catalog.closest(t).time(), "closest to " + t);
        }
    }

    @Test
    void filtersApplyBeforeClosest() throws Exception {
        seed(NOON, b -> b.parameterId(8).domain("Munich"));
        seed(NOON.plusSeconds(3600), b -> b.parameterId(10).domain("Munich"));

        QueryFilter morrison = QueryFilter.builder().parameterId(10).build();
        assertEquals(NOON.plusSeconds(3600), catalog.closest(NOON, morrison).time());
    }

    @Test
    void rangeIsInclusiveAndOrdered() {
        seed(NOON.plusSeconds(600));
        seed(NOON);
        seed(NOON.plusSeconds(300));
        seed(NOON.plusSeconds(900));

        List<Instant> times = catalog.range(NOON, NOON.plusSeconds(600)).stream()
                .map(ResultHandle::time)
                .toList();

        assertEquals(List.of(NOON, NOON.plusSeconds(300), NOON.plusSeconds(600)), times);
    }

    @Test
    void widerRangeContainsNarrowerRange() {
        for (int i = 0; i < 20; i++) {
            seed(NOON.plusSeconds(150L * i));
        }

        List<Long> narrow = ids(catalog.range(NOON.plusSeconds(700), NOON.plusSeconds(1500)));
        for (long epsilon : new long[]{0, 1, 149, 150, 10_000}) {
            List<ResultHandle<Map<String, String>>> wide = catalog.range(
                    NOON.plusSeconds(700 - epsilon), NOON.plusSeconds(1500 + epsilon));
            assertTrue(ids(wide).containsAll(narrow));
            for (int i = 1; i < wide.size(); i++) {
                assertTrue(!wide.get(i).time().isBefore(wide.get(i - 1).time()));
            }
        }
    }

    @Test
    void emptyOrInvertedRangeIsNotAnError() {
        seed(NOON);

        assertTrue(catalog.range(NOON.plusSeconds(1), NOON.plusSeconds(60)).isEmpty());
        assertTrue(catalog.range(NOON.plusSeconds(60), NOON).isEmpty());
    }

    @Test
    void containedRangeExcludesObservationsRunningPastTheEnd() throws Exception {
        ProductDefinition<Map<String, String>> contained = ProductDefinition
                .builder(TestProducts.NAME, KeyValueParser.wrfIdentity(), new KeyValueLoader())
                .kind(KindRule.prefix("wrfout", "wrfout"))
                .rangeMode(RangeMode.CONTAINED)
                .build();
        seed(NOON, b -> b.endTime(NOON.plusSeconds(300)));
        seed(NOON.plusSeconds(600), b -> b.endTime(NOON.plusSeconds(1800)));

        assertEquals(2, catalog.range(NOON, NOON.plusSeconds(900)).size());
        try (Catalog<Map<String, String>> wrf = Catalog.open(contained, Path.of("unused"), store,
                CatalogOptions.readOnly())) {
            assertEquals(List.of(NOON), wrf.range(NOON, NOON.plusSeconds(900)).stream()
                    .map(ResultHandle::time).toList());
        }
    }

    @Test
    void latestReturnsWhatExists() {
        seed(NOON);

        assertEquals(1, catalog.latest(3).size());
    }

    @Test
    void latestIsNewestFirst() {
        seed(NOON);
        seed(NOON.plusSeconds(600));
        seed(NOON.plusSeconds(300));

        List<Instant> times = catalog.latest(2).stream().map(ResultHandle::time).toList();

        assertEquals(List.of(NOON.plusSeconds(600), NOON.plusSeconds(300)), times);
        assertTrue(catalog.latest(0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> catalog.latest(-1));
    }

    @Test
    void filtersCombineAsConjunction() {
        seed(NOON, b -> b.parameterId(8).radar("Isen").hydrometeor("snow"));
        seed(NOON.plusSeconds(300), b -> b.parameterId(8).radar("Isen").hydrometeor("rain"));
        seed(NOON.plusSeconds(600), b -> b.parameterId(10).radar("Isen").hydrometeor("snow"));

        QueryFilter filter = QueryFilter.builder().parameterId(8).hydrometeor("snow").build();

        assertEquals(List.of(NOON), catalog.range(NOON, NOON.plusSeconds(600), filter).stream()
                .map(ResultHandle::time).toList());
        assertEquals(3, catalog.latest(5, QueryFilter.builder().radar("Isen").build()).size());
    }

    @Test
    void filtersAreValidatedAgainstTheProduct() {
        seed(NOON);

        // Method is not a filter of this product
        assertThrows(IllegalArgumentException.class,
                () -> catalog.latest(1, QueryFilter.builder().method("Dolan").build()));
        // Poldirad is not a known radar
        assertThrows(IllegalArgumentException.class,
                () -> catalog.range(NOON, NOON, QueryFilter.builder().radar("Poldirad").build()));
        assertThrows(IllegalArgumentException.class,
                () -> catalog.closest(NOON, QueryFilter.builder().parameterId(9).build()));
    }

    private void seed(Instant time) {
        seed(time, b -> {
        });
    }

    private void seed(Instant time, Consumer<DatasetAttributes.Builder> attributes) {
        DatasetAttributes.Builder builder = DatasetAttributes.at(time);
        attributes.accept(builder);
        String path = "/data/wrfout_" + (counter++);
        try (StoreTransaction tx = store.begin()) {
            tx.upsertFile(new FileRecord(path, new FileKind("wrfout"), TestProducts.OLD_MTIME, CHECKED));
            tx.insertDataset(DatasetRecord.create(new IdentityKey("seed=" + counter), "wrfout", path,
                    builder.build()));
            tx.commit();
        }
    }

    private static List<Long> ids(List<ResultHandle<Map<String, String>>> handles) {
        List<Long> ids = new ArrayList<>();
        handles.forEach(h -> ids.add(h.datasetId()));
        return ids;
    }
}
