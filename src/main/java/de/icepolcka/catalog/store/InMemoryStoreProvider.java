package de.icepolcka.catalog.store;

import de.icepolcka.catalog.error.CatalogOpenException;
import de.icepolcka.catalog.product.ProductDefinition;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory stores for development. A store is kept per path for the lifetime of the application,
 * so reopening a catalog sees earlier syncs; nothing survives a restart.
 */
@ApplicationScoped
@IfBuildProperty(name = "catalog.store.type", stringValue = "memory")
public class InMemoryStoreProvider implements CatalogStoreProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStoreProvider.class);

    private final Map<Path, InMemoryCatalogStore> stores = new ConcurrentHashMap<>();

    @Override
    public CatalogStore open(Path storePath, ProductDefinition<?> product) throws CatalogOpenException {
        InMemoryCatalogStore store = stores.computeIfAbsent(storePath.toAbsolutePath().normalize(), p -> {
            LOG.infof("Creating in-memory store for %s (%s)", product.name(), p);
            return new InMemoryCatalogStore(product.name(), product.referenceData());
        });
        if (!store.productName().equals(product.name())) {
            throw new CatalogOpenException("Store " + storePath + " belongs to product " + store.productName()
                    + ", not " + product.name());
        }
        return store;
    }
}
