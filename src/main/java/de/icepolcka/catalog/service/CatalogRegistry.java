package de.icepolcka.catalog.service;

import de.icepolcka.catalog.domain.SyncSummary;
import de.icepolcka.catalog.error.CatalogOpenException;
import de.icepolcka.catalog.error.SyncException;
import de.icepolcka.catalog.index.Catalog;
import de.icepolcka.catalog.index.CatalogOptions;
import de.icepolcka.catalog.product.ProductDefinition;
import de.icepolcka.catalog.source.SourceProvider;
import de.icepolcka.catalog.store.CatalogStore;
import de.icepolcka.catalog.store.CatalogStoreProvider;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Set;
import java.util.TreeSet;

/**
 * Opens catalogs for the products registered as beans, using the paths and flags
 * configured under {@code catalog.products.<name>}.
 */
@ApplicationScoped
public class CatalogRegistry {

    private static final Logger LOG = Logger.getLogger(CatalogRegistry.class);

    @Inject
    CatalogConfig config;

    @Inject
    CatalogStoreProvider storeProvider;

    @Inject
    SourceProvider sourceProvider;

    @Inject
    @Any
    Instance<ProductDefinition<?>> definitions;

    /**
     * Products that have both a definition bean and a configuration entry.
     */
    public Set<String> products() {
        Set<String> names = new TreeSet<>();
        for (ProductDefinition<?> definition : definitions) {
            if (config.products().containsKey(definition.name())) {
                names.add(definition.name());
            }
        }
        return names;
    }

    public Catalog<?> open(String name) throws CatalogOpenException, SyncException {
        return open(definition(name));
    }

    public Catalog<?> open(String name, CatalogOptions options) throws CatalogOpenException, SyncException {
        return open(definition(name), options);
    }

    /**
     * Open {@code product} with the sync and recheck flags configured for it.
     */
    public <D> Catalog<D> open(ProductDefinition<D> product) throws CatalogOpenException, SyncException {
        CatalogConfig.Product settings = settings(product.name());
        return open(product, new CatalogOptions(settings.sync(), settings.recheck()));
    }

    public <D> Catalog<D> open(ProductDefinition<D> product, CatalogOptions options)
            throws CatalogOpenException, SyncException {
        CatalogConfig.Product settings = settings(product.name());

        LOG.debugf("Opening catalog %s (root %s, store %s)", product.name(), settings.rootDir(),
                settings.storePath());
        CatalogStore store = storeProvider.open(Path.of(settings.storePath()), product);
        return Catalog.open(product, Path.of(settings.rootDir()), store, options, sourceProvider,
                Clock.systemUTC());
    }

    /**
     * Bring a product's store up to date with its directory tree, then close it.
     */
    public SyncSummary update(String name) throws CatalogOpenException, SyncException {
        CatalogConfig.Product settings = settings(name);
        try (Catalog<?> catalog = open(name, new CatalogOptions(false, settings.recheck()))) {
            return catalog.sync();
        }
    }

    private CatalogConfig.Product settings(String name) {
        CatalogConfig.Product settings = config.products().get(name);
        if (settings == null) {
            throw new IllegalArgumentException("No configuration for product " + name
                    + " under catalog.products");
        }
        return settings;
    }

    private ProductDefinition<?> definition(String name) {
        for (ProductDefinition<?> definition : definitions) {
            if (definition.name().equals(name)) {
                return definition;
            }
        }
        throw new IllegalArgumentException("No product definition registered for " + name);
    }
}
