package de.icepolcka.catalog.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Denormalized descriptive fields of a dataset. {@code time} is the primary time
 * used by every query; the remaining fields are optional and product specific.
 */
public record DatasetAttributes(
        Instant time,
        Instant endTime,
        Integer parameterId,
        String source,
        String radar,
        String domain,
        String method,
        String hydrometeor,
        String model
) {
    public DatasetAttributes {
        if (time == null) {
            throw new IllegalArgumentException("time cannot be null");
        }
        if (endTime != null && endTime.isBefore(time)) {
            throw new IllegalArgumentException("endTime " + endTime + " is before time " + time);
        }
    }

    public static Builder at(Instant time) {
        return new Builder(time);
    }

    public Optional<Object> get(Attribute attribute) {
        Object value = switch (attribute) {
            case TIME -> time;
            case END_TIME -> endTime;
            case PARAMETER_ID -> parameterId;
            case SOURCE -> source;
            case RADAR -> radar;
            case DOMAIN -> domain;
            case METHOD -> method;
            case HYDROMETEOR -> hydrometeor;
            case MODEL -> model;
        };
        return Optional.ofNullable(value);
    }

    /**
     * Time at which the observation ends; equals {@link #time()} for instantaneous data.
     */
    public Instant effectiveEndTime() {
        return endTime != null ? endTime : time;
    }

    /**
     * Overlay freshly parsed values on this one. Non-null fields of {@code fresh} win.
     */
    public DatasetAttributes mergedWith(DatasetAttributes fresh) {
        return new DatasetAttributes(
                fresh.time,
                fresh.endTime != null ? fresh.endTime : endTime,
                fresh.parameterId != null ? fresh.parameterId : parameterId,
                fresh.source != null ? fresh.source : source,
                fresh.radar != null ? fresh.radar : radar,
                fresh.domain != null ? fresh.domain : domain,
                fresh.method != null ? fresh.method : method,
                fresh.hydrometeor != null ? fresh.hydrometeor : hydrometeor,
                fresh.model != null ? fresh.model : model
        );
    }

    public static final class Builder {
        private final Instant time;
        private Instant endTime;
        private Integer parameterId;
        private String source;
        private String radar;
        private String domain;
        private String method;
        private String hydrometeor;
        private String model;

        private Builder(Instant time) {
            this.time = time;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder parameterId(Integer parameterId) {
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

        public DatasetAttributes build() {
            return new DatasetAttributes(time, endTime, parameterId, source, radar, domain, method,
                    hydrometeor, model);
        }
    }
}
