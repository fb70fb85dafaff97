package com.codegraph.core.extractor;

import com.codegraph.core.model.Language;
import com.codegraph.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;

/**
 * Selects an {@link Extractor} by file extension.
 *
 * <p>The default registry discovers extractors through {@link ServiceLoader}. When two
 * extractors claim the same extension the first registered one wins and a warning is logged.
 */
public class ExtractorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExtractorRegistry.class);

    private final List<Extractor> extractors;
    private final Map<String, Extractor> byExtension = new LinkedHashMap<>();

    public ExtractorRegistry(List<Extractor> extractors) {
        this.extractors = List.copyOf(extractors);
        for (Extractor extractor : this.extractors) {
            for (String extension : extractor.getSupportedExtensions()) {
                Extractor previous = byExtension.putIfAbsent(extension, extractor);
                if (previous != null) {
                    log.warn("Extension .{} claimed by both {} and {}; keeping {}",
                        extension, previous.getId(), extractor.getId(), previous.getId());
                }
            }
        }
    }

    /**
     * Creates a registry from all extractors registered via SPI.
     *
     * @return registry of discovered extractors
     */
    public static ExtractorRegistry loadDefault() {
        List<Extractor> found = new ArrayList<>();
        ServiceLoader.load(Extractor.class).forEach(found::add);
        log.debug("Discovered {} extractors", found.size());
        if (log.isDebugEnabled()) {
            found.forEach(e -> log.debug("  - {} ({})", e.getId(), e.getDisplayName()));
        }
        return new ExtractorRegistry(found);
    }

    public List<Extractor> all() {
        return Collections.unmodifiableList(extractors);
    }

    /**
     * Finds the extractor responsible for a file.
     *
     * @param filePath path or file name
     * @return extractor, or empty if the extension is not supported
     */
    public Optional<Extractor> forFile(String filePath) {
        return Optional.ofNullable(byExtension.get(FileUtils.getExtension(filePath)));
    }

    public Optional<Language> languageOf(String filePath) {
        return forFile(filePath).map(extractor -> extractor.languageOf(filePath));
    }

    public Set<String> supportedExtensions() {
        return Collections.unmodifiableSet(new TreeSet<>(byExtension.keySet()));
    }

    public Set<Language> supportedLanguages() {
        Set<Language> languages = new TreeSet<>();
        extractors.forEach(e -> languages.addAll(e.getSupportedLanguages()));
        return languages;
    }
}
