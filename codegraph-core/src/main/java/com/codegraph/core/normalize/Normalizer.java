package com.codegraph.core.normalize;

import com.codegraph.core.extractor.ExtractionResult;
import com.codegraph.core.extractor.RawEntity;
import com.codegraph.core.extractor.RawRelation;
import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.EntityKind;
import com.codegraph.core.model.RelationType;
import com.codegraph.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns extraction results into graph entities and relations.
 *
 * <p>Normalization happens in two passes. The first assigns ids to every raw entity,
 * disambiguating qualified names that occur twice in one file with a {@code #n} suffix,
 * maps extractor vocabulary onto {@link EntityKind}, and emits a CONTAINS relation from each
 * entity's parent. The second resolves relation targets against a {@link NameIndex} built
 * from the new entities plus the existing entities of the project:
 * <ol>
 *   <li>exact qualified name</li>
 *   <li>scope walk: the enclosing scope of the source, shortened one segment at a time</li>
 *   <li>unique simple-name or suffix match, preferring the source file (confidence x 0.8)</li>
 *   <li>otherwise external</li>
 * </ol>
 *
 * <p>Import targets resolve to the module containing the imported entity. Self-relations
 * are dropped and duplicate relations collapse onto one id.
 */
public class Normalizer {

    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    static final double GLOBAL_MATCH_PENALTY = 0.8;
    private static final List<String> PACKAGE_MODULE_SUFFIXES = List.of(".__init__", ".index");

    private final String projectId;

    public Normalizer(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be blank");
        }
        this.projectId = projectId;
    }

    /**
     * How a relation target was found.
     */
    private enum Resolution {
        EXACT, SCOPE, GLOBAL, EXTERNAL
    }

    private record Resolved(CodeEntity target, Resolution resolution) {}

    /**
     * Normalizes the results of a set of files.
     *
     * @param results extraction results of the files being (re-)analysed
     * @param existingEntities entities of the project outside those files, used for resolution
     * @return entities, relations and warnings
     */
    public NormalizationResult normalize(List<ExtractionResult> results, Collection<CodeEntity> existingEntities) {
        Objects.requireNonNull(results, "results must not be null");
        List<String> warnings = new ArrayList<>();
        List<CodeEntity> entities = new ArrayList<>();
        Map<String, CodeRelation> relations = new LinkedHashMap<>();
        List<String[]> localIds = new ArrayList<>();

        for (ExtractionResult result : results) {
            localIds.add(assignEntities(result, entities, relations, warnings));
        }

        List<CodeEntity> all = new ArrayList<>(existingEntities == null ? List.of() : existingEntities);
        all.addAll(entities);
        NameIndex index = new NameIndex(all);

        int unresolved = 0;
        for (int r = 0; r < results.size(); r++) {
            ExtractionResult result = results.get(r);
            String[] ids = localIds.get(r);
            double weight = result.confidence().getWeight();
            for (RawRelation raw : result.relations()) {
                if (raw.sourceLocalId() < 0 || raw.sourceLocalId() >= ids.length) {
                    warnings.add("Dropped relation with unknown source in " + result.filePath());
                    continue;
                }
                CodeEntity source = index.byId(ids[raw.sourceLocalId()]).orElseThrow();
                RelationType type = VocabularyMapper.relationType(raw.type()).orElseGet(() -> {
                    warnings.add("Unknown relation type '" + raw.type() + "' in " + result.filePath() + ", mapped to USES");
                    return RelationType.USES;
                });
                CodeRelation relation = resolveRelation(source, raw, type, weight, index);
                if (relation == null) {
                    continue;
                }
                if (relation.isExternal()) {
                    unresolved++;
                    log.debug("Unresolved {} reference from {} to {}", type, source.qualifiedName(), raw.targetName());
                }
                relations.putIfAbsent(relation.id(), relation);
            }
        }
        log.debug("Normalized {} files: {} entities, {} relations, {} unresolved",
            results.size(), entities.size(), relations.size(), unresolved);
        return new NormalizationResult(entities, new ArrayList<>(relations.values()), warnings, unresolved);
    }

    // ==================== Entities ====================

    private String[] assignEntities(ExtractionResult result, List<CodeEntity> entities,
                                    Map<String, CodeRelation> relations, List<String> warnings) {
        List<RawEntity> raws = result.entities();
        String[] ids = new String[raws.size()];
        Map<String, Integer> seen = new HashMap<>();

        for (RawEntity raw : raws) {
            String qualifiedName = raw.qualifiedName();
            int occurrence = seen.merge(qualifiedName, 1, Integer::sum);
            if (occurrence > 1) {
                String disambiguated = qualifiedName + "#" + occurrence;
                warnings.add("IdCollision: " + qualifiedName + " in " + result.filePath() + " renamed to " + disambiguated);
                qualifiedName = disambiguated;
            }
            EntityKind kind = VocabularyMapper.entityKind(raw.kind()).orElseGet(() -> {
                warnings.add("Unknown entity kind '" + raw.kind() + "' for " + raw.qualifiedName() + ", mapped to UNKNOWN");
                return EntityKind.UNKNOWN;
            });
            String id = IdGenerator.generate(projectId, qualifiedName, result.filePath());
            ids[raw.localId()] = id;

            Map<String, Object> metadata = new LinkedHashMap<>(raw.metadata());
            if (!raw.kind().equalsIgnoreCase(kind.name())) {
                metadata.put("sourceKind", raw.kind());
            }
            String parentId = raw.hasParent() && raw.parentLocalId() < raw.localId() ? ids[raw.parentLocalId()] : null;
            entities.add(new CodeEntity(id, projectId, raw.name(), qualifiedName, kind, result.language(),
                result.filePath(), raw.lineStart(), raw.lineEnd(), raw.signature(), raw.docSummary(), parentId,
                metadata));

            if (parentId != null) {
                CodeRelation contains = new CodeRelation(
                    IdGenerator.generate(projectId, parentId, RelationType.CONTAINS.name(), id),
                    projectId, parentId, id, qualifiedName, RelationType.CONTAINS, 1.0, Map.of());
                relations.putIfAbsent(contains.id(), contains);
            }
        }
        return ids;
    }

    // ==================== Relations ====================

    private CodeRelation resolveRelation(CodeEntity source, RawRelation raw, RelationType type, double weight,
                                         NameIndex index) {
        String targetName = raw.targetName();
        Resolved resolved = type == RelationType.IMPORTS
            ? resolveImport(targetName, source, index)
            : resolve(targetName, source, index);

        Map<String, Object> metadata = new LinkedHashMap<>(raw.metadata());
        if (raw.line() > 0) {
            metadata.put("line", raw.line());
        }
        metadata.put("resolution", resolved.resolution().name().toLowerCase(Locale.ROOT));

        if (resolved.target() == null) {
            return new CodeRelation(relationId(source.id(), type, null, targetName), projectId, source.id(), null,
                targetName, type, weight, metadata);
        }
        CodeEntity target = resolved.target();
        if (target.id().equals(source.id())) {
            return null;
        }
        if (!targetName.equals(target.qualifiedName())) {
            metadata.put("written", targetName);
        }
        double confidence = resolved.resolution() == Resolution.GLOBAL ? weight * GLOBAL_MATCH_PENALTY : weight;
        return new CodeRelation(relationId(source.id(), type, target.id(), null), projectId, source.id(), target.id(),
            target.qualifiedName(), type, confidence, metadata);
    }

    private String relationId(String sourceId, RelationType type, String targetId, String targetName) {
        return IdGenerator.generate(projectId, sourceId, type.name(),
            targetId != null ? targetId : "external:" + targetName);
    }

    /**
     * Resolves a name referenced from {@code source}.
     */
    private Resolved resolve(String targetName, CodeEntity source, NameIndex index) {
        Optional<CodeEntity> exact = pick(index.byQualifiedName(targetName), source);
        if (exact.isPresent()) {
            return new Resolved(exact.get(), Resolution.EXACT);
        }

        String scope = source.qualifiedName();
        int hash = scope.indexOf('#');
        if (hash > 0) {
            scope = scope.substring(0, hash);
        }
        while (!scope.isEmpty()) {
            Optional<CodeEntity> scoped = pick(index.byQualifiedName(scope + "." + targetName), source);
            if (scoped.isPresent()) {
                return new Resolved(scoped.get(), Resolution.SCOPE);
            }
            int dot = scope.lastIndexOf('.');
            scope = dot >= 0 ? scope.substring(0, dot) : "";
        }

        List<CodeEntity> candidates = index.bySuffix(targetName).stream()
            .filter(candidate -> !candidate.id().equals(source.id()))
            .toList();
        List<CodeEntity> sameFile = candidates.stream()
            .filter(candidate -> candidate.filePath().equals(source.filePath()))
            .toList();
        if (sameFile.size() == 1) {
            return new Resolved(sameFile.get(0), Resolution.GLOBAL);
        }
        if (candidates.size() == 1) {
            return new Resolved(candidates.get(0), Resolution.GLOBAL);
        }
        return new Resolved(null, Resolution.EXTERNAL);
    }

    /**
     * Resolves an import target and lifts it to the containing module.
     *
     * <p>Besides the general strategy, the module name itself is tried with package markers
     * ({@code __init__}, {@code index}) and with trailing segments removed, so
     * {@code pkg.mod.func} resolves to module {@code pkg.mod}.
     */
    private Resolved resolveImport(String targetName, CodeEntity source, NameIndex index) {
        Optional<CodeEntity> direct = pick(index.byQualifiedName(targetName), source);
        if (direct.isEmpty()) {
            for (String suffix : PACKAGE_MODULE_SUFFIXES) {
                direct = pick(index.byQualifiedName(targetName + suffix), source);
                if (direct.isPresent()) {
                    break;
                }
            }
        }
        if (direct.isPresent()) {
            return new Resolved(liftToModule(direct.get(), index), Resolution.EXACT);
        }

        String prefix = targetName;
        int dot = prefix.lastIndexOf('.');
        while (dot > 0) {
            prefix = prefix.substring(0, dot);
            Optional<CodeEntity> module = pick(index.byQualifiedName(prefix), source)
                .filter(entity -> entity.kind() == EntityKind.MODULE);
            if (module.isPresent()) {
                return new Resolved(module.get(), Resolution.EXACT);
            }
            dot = prefix.lastIndexOf('.');
        }

        List<CodeEntity> candidates = targetName.contains(".") ? index.bySuffix(targetName) : List.of();
        if (candidates.size() == 1) {
            return new Resolved(liftToModule(candidates.get(0), index), Resolution.GLOBAL);
        }
        return new Resolved(null, Resolution.EXTERNAL);
    }

    private static CodeEntity liftToModule(CodeEntity entity, NameIndex index) {
        if (entity.kind() == EntityKind.MODULE) {
            return entity;
        }
        return index.moduleOf(entity.filePath()).orElse(entity);
    }

    private static Optional<CodeEntity> pick(List<CodeEntity> candidates, CodeEntity source) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return candidates.stream()
            .filter(candidate -> candidate.filePath().equals(source.filePath()))
            .findFirst()
            .or(() -> Optional.of(candidates.get(0)));
    }
}
