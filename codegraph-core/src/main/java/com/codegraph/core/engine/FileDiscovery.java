package com.codegraph.core.engine;

import com.codegraph.core.extractor.ExtractorRegistry;
import com.codegraph.core.model.Language;
import com.codegraph.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks a source tree and selects the files an extractor can handle.
 *
 * <p>Well-known tool and dependency directories are never entered. Files are dropped when
 * they match an exclude glob, have no extractor, are not in the language filter or exceed
 * the size limit. The result is sorted by relative path.
 */
public class FileDiscovery {

    private static final Logger log = LoggerFactory.getLogger(FileDiscovery.class);

    public static final Set<String> SKIPPED_DIRECTORIES = Set.of(
        ".git", "node_modules", "venv", ".venv", "__pycache__", "build", "dist", "target", ".idea", ".gradle"
    );

    private final ExtractorRegistry registry;
    private final long maxFileSizeBytes;

    public FileDiscovery(ExtractorRegistry registry, long maxFileSizeBytes) {
        this.registry = registry;
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    /**
     * Lists the analysable files below {@code root}.
     *
     * @param root directory to walk
     * @param languageFilter accepted languages; null or empty accepts all
     * @param excludePatterns glob patterns matched against relative paths and file names
     * @return selected files sorted by relative path
     * @throws IOException if the tree cannot be walked
     */
    public List<DiscoveredFile> discover(Path root, Set<Language> languageFilter, List<String> excludePatterns)
        throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }
        List<PathMatcher> excludes = FileUtils.globMatchers(excludePatterns);
        List<DiscoveredFile> files = new ArrayList<>();
        int[] skipped = new int[1];

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && SKIPPED_DIRECTORIES.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                String relative = FileUtils.relativePath(root, file);
                Optional<DiscoveredFile> selected = select(file, relative, attrs.size(), languageFilter, excludes);
                if (selected.isPresent()) {
                    files.add(selected.get());
                } else {
                    skipped[0]++;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Cannot read {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        files.sort(Comparator.comparing(DiscoveredFile::relativePath));
        log.debug("Discovered {} files under {} ({} skipped)", files.size(), root, skipped[0]);
        return files;
    }

    /**
     * Applies the selection rules to one file.
     *
     * @return the file, or empty if it is not analysed
     */
    public Optional<DiscoveredFile> select(Path file, String relativePath, long size, Set<Language> languageFilter,
                                           List<PathMatcher> excludes) {
        if (FileUtils.matchesAny(relativePath, excludes)) {
            return Optional.empty();
        }
        Optional<Language> language = registry.languageOf(relativePath);
        if (language.isEmpty()) {
            return Optional.empty();
        }
        if (languageFilter != null && !languageFilter.isEmpty() && !languageFilter.contains(language.get())) {
            return Optional.empty();
        }
        if (size > maxFileSizeBytes) {
            log.info("Skipping {}: {} bytes exceeds limit of {}", relativePath, size, maxFileSizeBytes);
            return Optional.empty();
        }
        return Optional.of(new DiscoveredFile(file, relativePath, language.get(), size));
    }
}
