package de.icepolcka.catalog.source;

import de.icepolcka.catalog.domain.FileDescriptor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

public interface SourceProvider {

    /**
     * Every regular file below {@code root}, in lexicographic path order, minus those matching
     * one of the exclude globs. Entries that cannot be read are included as
     * {@link FileDescriptor#unreadable(Path)}.
     */
    Stream<FileDescriptor> list(Path root, List<String> excludePatterns) throws IOException;
}
