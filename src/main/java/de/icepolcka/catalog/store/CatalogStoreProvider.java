package de.icepolcka.catalog.store;

import de.icepolcka.catalog.error.CatalogOpenException;
import de.icepolcka.catalog.product.ProductDefinition;

import java.nio.file.Path;

/**
 * Opens the store backing a product catalog.
 */
public interface CatalogStoreProvider {
    CatalogStore open(Path storePath, ProductDefinition<?> product) throws CatalogOpenException;
}
