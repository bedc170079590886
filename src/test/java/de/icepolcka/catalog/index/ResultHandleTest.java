package de.icepolcka.catalog.index;

import de.icepolcka.catalog.domain.Attribute;
import de.icepolcka.catalog.error.DatasetLoadException;
import de.icepolcka.catalog.fixtures.KeyValueLoader;
import de.icepolcka.catalog.fixtures.KeyValueParser;
import de.icepolcka.catalog.fixtures.TestProducts;
import de.icepolcka.catalog.product.ReferenceData;
import de.icepolcka.catalog.store.InMemoryCatalogStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultHandleTest {

    private static final Instant T = Instant.parse("2019-07-01T12:00:00Z");

    private Path root;
    private KeyValueLoader loader;
    private Catalog<Map<String, String>> catalog;
    private Path wrfout;
    private Path clouds;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("catalog-handle-test");
        wrfout = TestProducts.write(root, "wrfout_1", "time=" + T, "mp_id=8", "domain=Munich");
        clouds = TestProducts.write(root, "clouds_1", "time=" + T, "mp_id=8", "domain=Munich", "hm=snow");
        loader = new KeyValueLoader();
        catalog = Catalog.open(TestProducts.wrfLike(KeyValueParser.wrfIdentity(), loader), root,
                new InMemoryCatalogStore(TestProducts.NAME, ReferenceData.icepolcka()), CatalogOptions.DEFAULT);
    }

    @AfterEach
    void tearDown() throws IOException {
        catalog.close();
        CatalogSyncTest.deleteRecursively(root);
    }

    @Test
    void queriesDoNotLoadData() throws Exception {
        ResultHandle<Map<String, String>> handle = catalog.closest(T);

        assertEquals(0, loader.calls());
        assertEquals(Set.of("wrfout", "clouds"), handle.roles());
        assertEquals(Optional.of(wrfout), handle.path("wrfout"));

        Map<String, String> data = handle.load();
        assertEquals(1, loader.calls());
        assertTrue(data.get("wrfout").contains("domain=Munich"));
        assertTrue(data.get("clouds").contains("hm=snow"));
    }

    @Test
    void attributesAreReadableByExternalName() throws Exception {
        ResultHandle<Map<String, String>> handle = catalog.latest(1).get(0);

        assertEquals(Optional.of(8), handle.attribute("mp_id"));
        assertEquals(Optional.of(T), handle.attribute("time"));
        assertEquals(Optional.of("snow"), handle.attribute(Attribute.HYDROMETEOR));
        assertEquals(Optional.empty(), handle.attribute("radar"));
        assertEquals(Optional.empty(), handle.attribute("no_such_attribute"));
    }

    @Test
    void singleRoleHandleLoadsOnlyThatFile() throws Exception {
        ResultHandle<Map<String, String>> handle = catalog.closest(T);

        ResultHandle<Map<String, String>> cloudsOnly = handle.forRole("clouds").orElseThrow();

        assertEquals(Map.of("clouds", clouds), cloudsOnly.paths());
        assertEquals(Set.of("clouds"), cloudsOnly.load().keySet());
        assertTrue(handle.forRole("wrfmp").isEmpty());
    }

    @Test
    void deletedFileFailsOnLoad() throws Exception {
        ResultHandle<Map<String, String>> handle = catalog.closest(T);
        Files.delete(clouds);

        DatasetLoadException e = assertThrows(DatasetLoadException.class, handle::load);

        assertTrue(e.getCause() instanceof NoSuchFileException);
        assertEquals(handle.paths(), e.paths());
    }

    @Test
    void handleOutlivesItsCatalog() throws Exception {
        ResultHandle<Map<String, String>> handle = catalog.closest(T);
        catalog.close();

        assertEquals(T, handle.time());
        assertEquals(2, handle.load().size());
    }
}
