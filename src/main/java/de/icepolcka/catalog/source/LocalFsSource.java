package de.icepolcka.catalog.source;

import de.icepolcka.catalog.domain.FileDescriptor;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Source provider for a local directory tree.
 * The walk is sorted so that repeated syncs visit files in the same order. Entries that cannot be
 * read are reported as unreadable instead of failing the walk.
 */
@ApplicationScoped
public class LocalFsSource implements SourceProvider {

    private static final Logger LOG = Logger.getLogger(LocalFsSource.class);

    @Override
    public Stream<FileDescriptor> list(Path root, List<String> excludePatterns) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Source path does not exist or is not a directory: " + root);
        }

        List<PathMatcher> excludes = excludePatterns.stream()
                .map(p -> FileSystems.getDefault().getPathMatcher("glob:" + p))
                .toList();

        TreeCollector collector = new TreeCollector(root, excludes);
        Files.walkFileTree(root, collector);
        return collector.descriptors().stream();
    }

    /**
     * Collects regular files below {@code root}. A failure on the root itself is rethrown.
     */
    static final class TreeCollector extends SimpleFileVisitor<Path> {

        private final Path root;
        private final List<PathMatcher> excludes;
        private final List<FileDescriptor> found = new ArrayList<>();

        TreeCollector(Path root, List<PathMatcher> excludes) {
            this.root = root;
            this.excludes = excludes;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
            BasicFileAttributes target = attrs;
            if (attrs.isSymbolicLink()) {
                try {
                    target = Files.readAttributes(file, BasicFileAttributes.class);
                } catch (IOException e) {
                    return visitFileFailed(file, e);
                }
            }
            if (target.isRegularFile() && !isExcluded(file)) {
                found.add(new FileDescriptor(file, target.size(), target.lastModifiedTime().toInstant()));
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(root)) {
                throw exc;
            }
            if (exc instanceof NoSuchFileException) {
                // Removed while walking; the next sync will not see it either.
                LOG.warnf("File vanished during scan: %s", file);
            } else if (!isExcluded(file)) {
                LOG.warnf("Cannot read %s: %s", file, exc.getMessage());
                found.add(FileDescriptor.unreadable(file));
            }
            return FileVisitResult.CONTINUE;
        }

        List<FileDescriptor> descriptors() {
            List<FileDescriptor> sorted = new ArrayList<>(found);
            sorted.sort(Comparator.comparing(d -> d.path().toString()));
            return sorted;
        }

        private boolean isExcluded(Path file) {
            Path relative = root.relativize(file);
            Path name = file.getFileName();
            for (PathMatcher exclude : excludes) {
                if (exclude.matches(relative) || (name != null && exclude.matches(name))) {
                    LOG.debugf("Excluded by pattern: %s", file);
                    return true;
                }
            }
            return false;
        }
    }
}
