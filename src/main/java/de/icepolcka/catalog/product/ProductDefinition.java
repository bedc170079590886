package de.icepolcka.catalog.product;

import de.icepolcka.catalog.domain.Attribute;
import de.icepolcka.catalog.parser.DatasetLoader;
import de.icepolcka.catalog.parser.FileKindClassifier;
import de.icepolcka.catalog.parser.FileParser;
import de.icepolcka.catalog.parser.KindRule;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Everything that distinguishes one data product from another: which files belong to it,
 * how they are parsed and loaded, which attributes can be filtered on and the reference data
 * its store is seeded with.
 */
public record ProductDefinition<D>(
        String name,
        FileKindClassifier classifier,
        List<String> excludePatterns,
        Set<Attribute> filterable,
        RangeMode rangeMode,
        ReferenceData referenceData,
        FileParser parser,
        DatasetLoader<D> loader
) {
    public ProductDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Product name cannot be blank");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("Product " + name + " needs a file-kind classifier");
        }
        if (parser == null) {
            throw new IllegalArgumentException("Product " + name + " needs a parser");
        }
        if (loader == null) {
            throw new IllegalArgumentException("Product " + name + " needs a loader");
        }
        if (filterable != null && (filterable.contains(Attribute.TIME) || filterable.contains(Attribute.END_TIME))) {
            throw new IllegalArgumentException("Time attributes are queried by range, not filtered");
        }
        excludePatterns = excludePatterns != null ? List.copyOf(excludePatterns) : List.of();
        filterable = filterable != null && !filterable.isEmpty() ? Set.copyOf(EnumSet.copyOf(filterable)) : Set.of();
        rangeMode = rangeMode != null ? rangeMode : RangeMode.START_TIME;
        referenceData = referenceData != null ? referenceData : ReferenceData.EMPTY;
    }

    public static <D> Builder<D> builder(String name, FileParser parser, DatasetLoader<D> loader) {
        return new Builder<>(name, parser, loader);
    }

    public static final class Builder<D> {
        private final String name;
        private final FileParser parser;
        private final DatasetLoader<D> loader;
        private final List<KindRule> rules = new ArrayList<>();
        private final List<String> excludePatterns = new ArrayList<>();
        private final Set<Attribute> filterable = EnumSet.noneOf(Attribute.class);
        private RangeMode rangeMode = RangeMode.START_TIME;
        private ReferenceData referenceData = ReferenceData.EMPTY;

        private Builder(String name, FileParser parser, DatasetLoader<D> loader) {
            this.name = name;
            this.parser = parser;
            this.loader = loader;
        }

        public Builder<D> kind(KindRule rule) {
            rules.add(rule);
            return this;
        }

        public Builder<D> exclude(String globPattern) {
            excludePatterns.add(globPattern);
            return this;
        }

        public Builder<D> filterable(Attribute... attributes) {
            filterable.addAll(List.of(attributes));
            return this;
        }

        public Builder<D> rangeMode(RangeMode rangeMode) {
            this.rangeMode = rangeMode;
            return this;
        }

        public Builder<D> referenceData(ReferenceData referenceData) {
            this.referenceData = referenceData;
            return this;
        }

        public ProductDefinition<D> build() {
            return new ProductDefinition<>(name, new FileKindClassifier(rules), excludePatterns, filterable,
                    rangeMode, referenceData, parser, loader);
        }
    }
}
