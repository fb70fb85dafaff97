package com.codegraph.core.normalize;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.EntityKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup tables over the entities of one project, used to resolve relation targets.
 *
 * <p>Lists are ordered by id so resolution is deterministic regardless of insertion order.
 */
public final class NameIndex {

    private final Map<String, List<CodeEntity>> byQualifiedName = new HashMap<>();
    private final Map<String, List<CodeEntity>> bySimpleName = new HashMap<>();
    private final Map<String, CodeEntity> moduleByFile = new HashMap<>();
    private final Map<String, CodeEntity> byId = new HashMap<>();

    public NameIndex(Collection<CodeEntity> entities) {
        for (CodeEntity entity : entities) {
            add(entity);
        }
        Comparator<CodeEntity> byEntityId = Comparator.comparing(CodeEntity::id);
        byQualifiedName.values().forEach(list -> list.sort(byEntityId));
        bySimpleName.values().forEach(list -> list.sort(byEntityId));
    }

    private void add(CodeEntity entity) {
        byId.put(entity.id(), entity);
        byQualifiedName.computeIfAbsent(entity.qualifiedName(), key -> new ArrayList<>()).add(entity);
        bySimpleName.computeIfAbsent(simpleName(entity.qualifiedName()), key -> new ArrayList<>()).add(entity);
        if (entity.kind() == EntityKind.MODULE) {
            moduleByFile.put(entity.filePath(), entity);
        }
    }

    public List<CodeEntity> byQualifiedName(String qualifiedName) {
        return byQualifiedName.getOrDefault(qualifiedName, List.of());
    }

    /**
     * Returns entities whose qualified name equals {@code name} or ends with {@code "." + name}.
     *
     * @param name simple or partially qualified name
     * @return matching entities ordered by id
     */
    public List<CodeEntity> bySuffix(String name) {
        List<CodeEntity> candidates = bySimpleName.getOrDefault(simpleName(name), List.of());
        if (!name.contains(".")) {
            return candidates;
        }
        String suffix = "." + name;
        return candidates.stream()
            .filter(entity -> entity.qualifiedName().equals(name) || entity.qualifiedName().endsWith(suffix))
            .toList();
    }

    public Optional<CodeEntity> moduleOf(String filePath) {
        return Optional.ofNullable(moduleByFile.get(filePath));
    }

    public Optional<CodeEntity> byId(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return byId.size();
    }

    /**
     * Returns the last dot-separated segment of a name, ignoring a collision suffix.
     */
    static String simpleName(String qualifiedName) {
        String name = qualifiedName;
        int hash = name.indexOf('#');
        if (hash > 0) {
            name = name.substring(0, hash);
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }
}
