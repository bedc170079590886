package de.icepolcka.catalog.parser;

import de.icepolcka.catalog.domain.FileKind;
import de.icepolcka.catalog.domain.ParsedFile;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Extracts identifying keys from one data file. Implementations wrap the format libraries
 * of a product; the catalog treats any {@link IOException} as a corrupt file.
 */
@FunctionalInterface
public interface FileParser {
    ParsedFile parse(Path path, FileKind kind) throws IOException;
}
