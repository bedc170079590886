package de.icepolcka.catalog.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Descriptive attributes a dataset can carry. The external name is the key
 * exposed through result handles and used in identity keys.
 */
public enum Attribute {
    TIME("time"),
    END_TIME("end_time"),
    PARAMETER_ID("mp_id"),
    SOURCE("source"),
    RADAR("radar"),
    DOMAIN("domain"),
    METHOD("method"),
    HYDROMETEOR("hm"),
    MODEL("model");

    private final String externalName;

    Attribute(String externalName) {
        this.externalName = externalName;
    }

    public String externalName() {
        return externalName;
    }

    public static Optional<Attribute> byExternalName(String name) {
        return Arrays.stream(values())
                .filter(a -> a.externalName.equals(name))
                .findFirst();
    }
}
