package de.icepolcka.catalog.parser;

import de.icepolcka.catalog.domain.FileKind;

import java.util.List;
import java.util.Optional;

/**
 * Maps file names to kinds using a static, ordered rule table. First matching rule wins.
 */
public final class FileKindClassifier {

    private final List<KindRule> rules;

    public FileKindClassifier(List<KindRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("At least one kind rule is required");
        }
        this.rules = List.copyOf(rules);
    }

    public Optional<FileKind> classify(String fileName) {
        for (KindRule rule : rules) {
            if (rule.matches(fileName)) {
                return Optional.of(rule.kind());
            }
        }
        return Optional.empty();
    }
}
