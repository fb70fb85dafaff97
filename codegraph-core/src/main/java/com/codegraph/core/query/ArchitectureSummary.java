package com.codegraph.core.query;

import com.codegraph.core.model.EntityKind;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregated view of a project's structure.
 *
 * @param projectId summarized project
 * @param groupBy how modules were formed
 * @param totalFiles files in the project
 * @param totalEntities entities in the project
 * @param totalRelations relations in the project
 * @param entitiesByKind entity counts per kind
 * @param entitiesByLanguage entity counts per language id
 * @param modules per-group metrics ordered by name
 */
public record ArchitectureSummary(
    String projectId,
    GroupBy groupBy,
    int totalFiles,
    int totalEntities,
    int totalRelations,
    Map<EntityKind, Integer> entitiesByKind,
    Map<String, Integer> entitiesByLanguage,
    List<ModuleSummary> modules
) {
    public ArchitectureSummary {
        entitiesByKind = entitiesByKind == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(entitiesByKind));
        entitiesByLanguage = entitiesByLanguage == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(entitiesByLanguage));
        modules = modules == null ? List.of() : List.copyOf(modules);
    }
}
