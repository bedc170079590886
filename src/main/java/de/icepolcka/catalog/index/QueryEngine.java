package de.icepolcka.catalog.index;

import de.icepolcka.catalog.domain.Attribute;
import de.icepolcka.catalog.domain.DatasetRecord;
import de.icepolcka.catalog.domain.QueryFilter;
import de.icepolcka.catalog.error.DatasetNotFoundException;
import de.icepolcka.catalog.product.ProductDefinition;
import de.icepolcka.catalog.store.CatalogStore;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only temporal lookups over the committed datasets of one product.
 * Filters are validated against the product and applied before the temporal operation.
 */
final class QueryEngine<D> {

    private static final Logger LOG = Logger.getLogger(QueryEngine.class);

    private final CatalogStore store;
    private final ProductDefinition<D> product;

    QueryEngine(CatalogStore store, ProductDefinition<D> product) {
        this.store = store;
        this.product = product;
    }

    List<ResultHandle<D>> range(Instant start, Instant end, QueryFilter filter) {
        validate(filter);
        if (start.isAfter(end)) {
            LOG.debugf("Empty range %s > %s for %s", start, end, product.name());
            return List.of();
        }
        return handles(store.range(start, end, product.rangeMode(), filter));
    }

    /**
     * Dataset nearest to {@code time}. On equal distance the earlier one wins.
     */
    ResultHandle<D> closest(Instant time, QueryFilter filter) throws DatasetNotFoundException {
        validate(filter);
        Optional<DatasetRecord> lesser = store.latestAtOrBefore(time, filter);
        Optional<DatasetRecord> greater = store.earliestAfter(time, filter);

        if (lesser.isEmpty() && greater.isEmpty()) {
            throw new DatasetNotFoundException("No " + product.name() + " data found for " + filter);
        }
        if (greater.isEmpty()) {
            return handle(lesser.get());
        }
        if (lesser.isEmpty()) {
            return handle(greater.get());
        }

        Duration greaterDistance = Duration.between(time, greater.get().time()).abs();
        Duration lesserDistance = Duration.between(lesser.get().time(), time).abs();
        return greaterDistance.compareTo(lesserDistance) < 0
                ? handle(greater.get())
                : handle(lesser.get());
    }

    List<ResultHandle<D>> latest(int n, QueryFilter filter) {
        if (n < 0) {
            throw new IllegalArgumentException("n cannot be negative: " + n);
        }
        validate(filter);
        if (n == 0) {
            return List.of();
        }
        return handles(store.latest(n, filter));
    }

    private void validate(QueryFilter filter) {
        Set<Attribute> unsupported = EnumSet.noneOf(Attribute.class);
        unsupported.addAll(filter.constrained());
        unsupported.removeAll(product.filterable());
        if (!unsupported.isEmpty()) {
            throw new IllegalArgumentException(product.name() + " data cannot be filtered by " + unsupported);
        }
        store.referenceData().firstUnknown(filter).ifPresent(attribute -> {
            throw new IllegalArgumentException("Unknown " + attribute.externalName() + " for "
                    + product.name() + ": " + filter.valueOf(attribute));
        });
    }

    private List<ResultHandle<D>> handles(List<DatasetRecord> records) {
        return records.stream().map(this::handle).toList();
    }

    private ResultHandle<D> handle(DatasetRecord record) {
        return ResultHandle.of(record, product.loader());
    }
}
