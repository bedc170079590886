package de.icepolcka.catalog.parser;

import de.icepolcka.catalog.domain.FileKind;

import java.util.regex.Pattern;

/**
 * One row of a product's file-kind table. A file name matches when it has the prefix,
 * the suffix and matches the pattern; null parts are not checked.
 */
public record KindRule(
        FileKind kind,
        String prefix,
        String suffix,
        Pattern namePattern
) {
    public KindRule {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind.isCorrupt()) {
            throw new IllegalArgumentException("corrupt is reserved and cannot be matched by name");
        }
        if (prefix == null && suffix == null && namePattern == null) {
            throw new IllegalArgumentException("KindRule for " + kind + " matches nothing");
        }
    }

    public static KindRule prefix(String kind, String prefix) {
        return new KindRule(new FileKind(kind), prefix, null, null);
    }

    public static KindRule suffix(String kind, String suffix) {
        return new KindRule(new FileKind(kind), null, suffix, null);
    }

    public KindRule requiring(Pattern pattern) {
        return new KindRule(kind, prefix, suffix, pattern);
    }

    public boolean matches(String fileName) {
        if (prefix != null && !fileName.startsWith(prefix)) {
            return false;
        }
        if (suffix != null && !fileName.endsWith(suffix)) {
            return false;
        }
        return namePattern == null || namePattern.matcher(fileName).matches();
    }
}
