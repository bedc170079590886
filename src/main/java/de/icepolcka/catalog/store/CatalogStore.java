package de.icepolcka.catalog.store;

import de.icepolcka.catalog.domain.DatasetRecord;
import de.icepolcka.catalog.domain.FileRecord;
import de.icepolcka.catalog.domain.QueryFilter;
import de.icepolcka.catalog.product.RangeMode;
import de.icepolcka.catalog.product.ReferenceData;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent index of one product: accepted files, dataset records and reference data.
 * Reads see committed state only; all writes go through a {@link StoreTransaction}.
 *
 * <p>Temporal reads order datasets by (time, id).
 */
public interface CatalogStore extends AutoCloseable {

    String productName();

    ReferenceData referenceData();

    /**
     * Start the single write transaction of a sync pass.
     */
    StoreTransaction begin();

    Optional<FileRecord> findFile(String path);

    List<FileRecord> files();

    List<DatasetRecord> datasets();

    List<DatasetRecord> range(Instant start, Instant end, RangeMode mode, QueryFilter filter);

    /**
     * Last dataset (by time, then id) with time at or before {@code time}.
     */
    Optional<DatasetRecord> latestAtOrBefore(Instant time, QueryFilter filter);

    /**
     * First dataset (by time, then id) with time strictly after {@code time}.
     */
    Optional<DatasetRecord> earliestAfter(Instant time, QueryFilter filter);

    /**
     * Up to {@code limit} datasets, most recent first.
     */
    List<DatasetRecord> latest(int limit, QueryFilter filter);

    @Override
    void close();
}
