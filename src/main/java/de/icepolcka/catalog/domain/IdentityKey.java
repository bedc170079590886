package de.icepolcka.catalog.domain;

import de.icepolcka.catalog.util.IdentityDigest;

import java.util.EnumSet;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Canonical attribute tuple identifying one logical observation.
 * Files with equal keys belong to the same {@link DatasetRecord}.
 */
public record IdentityKey(String canonical) {

    public IdentityKey {
        if (canonical == null || canonical.isBlank()) {
            throw new IllegalArgumentException("IdentityKey cannot be blank");
        }
    }

    /**
     * Build a key from the given attributes of {@code attributes}, in enum order.
     * Present values are length-prefixed ({@code name=len:value}) so separators inside free-text
     * values cannot forge another tuple; absent values are encoded as {@code name=} with no length.
     */
    public static IdentityKey of(DatasetAttributes attributes, Attribute... parts) {
        if (parts.length == 0) {
            throw new IllegalArgumentException("IdentityKey needs at least one attribute");
        }
        Set<Attribute> selected = EnumSet.noneOf(Attribute.class);
        selected.addAll(Set.of(parts));

        StringJoiner joiner = new StringJoiner(";");
        for (Attribute attribute : selected) {
            String value = attributes.get(attribute)
                    .map(String::valueOf)
                    .map(v -> v.length() + ":" + v)
                    .orElse("");
            joiner.add(attribute.externalName() + "=" + value);
        }
        return new IdentityKey(joiner.toString());
    }

    public String digest() {
        return IdentityDigest.of(canonical);
    }

    @Override
    public String toString() {
        return canonical;
    }
}
