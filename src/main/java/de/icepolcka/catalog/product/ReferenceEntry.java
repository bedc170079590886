package de.icepolcka.catalog.product;

import de.icepolcka.catalog.domain.Attribute;

/**
 * One known value of a categorical attribute, e.g. radar "Isen" or microphysics scheme 8 "Thompson".
 * {@code code} is only used for numeric attributes.
 */
public record ReferenceEntry(
        Attribute category,
        String name,
        Integer code
) {
    public ReferenceEntry {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (category == Attribute.TIME || category == Attribute.END_TIME) {
            throw new IllegalArgumentException("Time attributes have no reference values");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (category == Attribute.PARAMETER_ID && code == null) {
            throw new IllegalArgumentException("Parameter entries need a numeric code");
        }
    }

    public static ReferenceEntry named(Attribute category, String name) {
        return new ReferenceEntry(category, name, null);
    }

    public static ReferenceEntry scheme(int code, String name) {
        return new ReferenceEntry(Attribute.PARAMETER_ID, name, code);
    }

    /**
     * Value this entry represents when compared with dataset attributes.
     */
    public Object value() {
        return category == Attribute.PARAMETER_ID ? code : name;
    }
}
