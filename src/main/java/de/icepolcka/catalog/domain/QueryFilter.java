package de.icepolcka.catalog.domain;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Equality predicates applied to datasets before a temporal query.
 * Unset (null) fields do not constrain the result.
 */
public record QueryFilter(
        Integer parameterId,
        String source,
        String radar,
        String domain,
        String method,
        String hydrometeor,
        String model
) {
    public static final QueryFilter NONE = new QueryFilter(null, null, null, null, null, null, null);

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Attributes this filter constrains.
     */
    public Set<Attribute> constrained() {
        Set<Attribute> attributes = EnumSet.noneOf(Attribute.class);
        if (parameterId != null) attributes.add(Attribute.PARAMETER_ID);
        if (source != null) attributes.add(Attribute.SOURCE);
        if (radar != null) attributes.add(Attribute.RADAR);
        if (domain != null) attributes.add(Attribute.DOMAIN);
        if (method != null) attributes.add(Attribute.METHOD);
        if (hydrometeor != null) attributes.add(Attribute.HYDROMETEOR);
        if (model != null) attributes.add(Attribute.MODEL);
        return attributes;
    }

    public Object valueOf(Attribute attribute) {
        return switch (attribute) {
            case PARAMETER_ID -> parameterId;
            case SOURCE -> source;
            case RADAR -> radar;
            case DOMAIN -> domain;
            case METHOD -> method;
            case HYDROMETEOR -> hydrometeor;
            case MODEL -> model;
            case TIME, END_TIME -> null;
        };
    }

    public boolean matches(DatasetAttributes attributes) {
        for (Attribute attribute : constrained()) {
            Object actual = attributes.get(attribute).orElse(null);
            if (!Objects.equals(valueOf(attribute), actual)) {
                return false;
            }
        }
        return true;
    }

    public static final class Builder {
        private Integer parameterId;
        private String source;
        private String radar;
        private String domain;
        private String method;
        private String hydrometeor;
        private String model;

        private Builder() {
        }

        public Builder parameterId(int parameterId) {
            this.parameterId = parameterId;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder radar(String radar) {
            this.radar = radar;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder hydrometeor(String hydrometeor) {
            this.hydrometeor = hydrometeor;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public QueryFilter build() {
            return new QueryFilter(parameterId, source, radar, domain, method, hydrometeor, model);
        }
    }
}
