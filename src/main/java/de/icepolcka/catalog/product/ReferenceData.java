package de.icepolcka.catalog.product;

import de.icepolcka.catalog.domain.Attribute;
import de.icepolcka.catalog.domain.DatasetAttributes;
import de.icepolcka.catalog.domain.QueryFilter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static lookup tables a product store is seeded with. An attribute with no entries is unrestricted.
 */
public final class ReferenceData {

    public static final ReferenceData EMPTY = new ReferenceData(List.of());

    private final List<ReferenceEntry> entries;

    public ReferenceData(Collection<ReferenceEntry> entries) {
        this.entries = List.copyOf(new LinkedHashSet<>(entries));
    }

    /**
     * Schemes, radars, domains, hydrometeor classes and models used across the IcePolCKa products.
     */
    public static ReferenceData icepolcka() {
        List<ReferenceEntry> entries = new ArrayList<>();
        entries.add(ReferenceEntry.scheme(8, "Thompson"));
        entries.add(ReferenceEntry.scheme(10, "Morrison"));
        entries.add(ReferenceEntry.scheme(28, "Thompson Aerosol Aware"));
        entries.add(ReferenceEntry.scheme(30, "Fast Spectral Bin"));
        entries.add(ReferenceEntry.scheme(50, "P3"));
        entries.add(ReferenceEntry.named(Attribute.RADAR, "Isen"));
        for (String domain : List.of("Europe", "Germany", "Munich")) {
            entries.add(ReferenceEntry.named(Attribute.DOMAIN, domain));
        }
        for (String hm : List.of("cloud", "ice", "rain", "snow", "graupel", "parimedice", "smallice",
                "unrimedice", "all")) {
            entries.add(ReferenceEntry.named(Attribute.HYDROMETEOR, hm));
        }
        entries.add(ReferenceEntry.named(Attribute.MODEL, "WRF"));
        return new ReferenceData(entries);
    }

    public List<ReferenceEntry> entries() {
        return entries;
    }

    public boolean restricts(Attribute category) {
        return entries.stream().anyMatch(e -> e.category() == category);
    }

    /**
     * True if {@code value} is a known value for the category, or the category is unrestricted.
     */
    public boolean accepts(Attribute category, Object value) {
        if (value == null || !restricts(category)) {
            return true;
        }
        return entries.stream()
                .filter(e -> e.category() == category)
                .anyMatch(e -> e.value().equals(value));
    }

    /**
     * First attribute of {@code attributes} that names an unknown reference value.
     */
    public Optional<Attribute> firstUnknown(DatasetAttributes attributes) {
        for (Attribute attribute : Attribute.values()) {
            Object value = attributes.get(attribute).orElse(null);
            if (!accepts(attribute, value)) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }

    public Optional<Attribute> firstUnknown(QueryFilter filter) {
        for (Attribute attribute : filter.constrained()) {
            if (!accepts(attribute, filter.valueOf(attribute))) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }

    /**
     * Entries of {@code other} that this data does not contain yet.
     */
    public List<ReferenceEntry> missingFrom(ReferenceData other) {
        Set<ReferenceEntry> present = Set.copyOf(entries);
        return other.entries.stream().filter(e -> !present.contains(e)).toList();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ReferenceData that && Set.copyOf(entries).equals(Set.copyOf(that.entries));
    }

    @Override
    public int hashCode() {
        return Set.copyOf(entries).hashCode();
    }

    @Override
    public String toString() {
        return "ReferenceData" + entries;
    }
}
