package de.icepolcka.catalog.store;

import de.icepolcka.catalog.error.CatalogOpenException;
import de.icepolcka.catalog.product.ProductDefinition;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.file.Path;

/**
 * Persistent H2 stores, one database file per product.
 */
@ApplicationScoped
@DefaultBean
public class H2StoreProvider implements CatalogStoreProvider {

    @Override
    public CatalogStore open(Path storePath, ProductDefinition<?> product) throws CatalogOpenException {
        return H2CatalogStore.open(storePath, product.name(), product.referenceData());
    }
}
