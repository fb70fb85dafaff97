package com.codegraph.core.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Discovers the registered {@link ReportGenerator}s.
 */
public final class ReportGenerators {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerators.class);

    private ReportGenerators() {
        // Utility class
    }

    /**
     * Returns every generator on the class path, ordered by id.
     */
    public static List<ReportGenerator> loadAll() {
        List<ReportGenerator> generators = new ArrayList<>();
        ServiceLoader.load(ReportGenerator.class).forEach(generators::add);
        generators.sort(Comparator.comparing(ReportGenerator::getId));
        log.debug("Discovered {} report generators", generators.size());
        return generators;
    }

    public static Optional<ReportGenerator> find(String id) {
        return loadAll().stream().filter(generator -> generator.getId().equalsIgnoreCase(id)).findFirst();
    }
}
