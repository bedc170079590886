package de.icepolcka.catalog.service;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Map;

/**
 * Catalog settings, one entry per product under {@code catalog.products.<name>}.
 */
@ConfigMapping(prefix = "catalog")
public interface CatalogConfig {

    Store store();

    Map<String, Product> products();

    interface Store {
        /**
         * {@code h2} or {@code memory}. Read at build time to select the store provider.
         */
        @WithDefault("h2")
        String type();
    }

    interface Product {
        /** Directory scanned recursively for data files. */
        String rootDir();

        /** Location of the product's store. */
        String storePath();

        /** Sync with the directory tree when the catalog is opened. */
        @WithDefault("true")
        boolean sync();

        /** Re-parse known files whose modification time moved past their watermark. */
        @WithDefault("false")
        boolean recheck();
    }
}
