package com.codegraph.core.quality;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.IssueType;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.RelationType;
import com.codegraph.core.model.Severity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reports entities with excessive or lopsided fan-in/fan-out.
 *
 * <p>Fan-out counts the distinct targets an entity depends on, external ones included;
 * fan-in counts the distinct entities depending on it. Only
 * {@link RelationType#COUPLING_TYPES} are considered.
 */
public class CouplingDetector {

    private final QualityThresholds thresholds;

    public CouplingDetector(QualityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Fan-in and fan-out of one entity.
     */
    public record Degree(int fanIn, int fanOut) {
        public int max() {
            return Math.max(fanIn, fanOut);
        }

        public double imbalance() {
            return (double) max() / Math.max(1, Math.min(fanIn, fanOut));
        }
    }

    public Map<String, Degree> degrees(List<CodeRelation> relations) {
        Map<String, Set<String>> targets = new HashMap<>();
        Map<String, Set<String>> sources = new HashMap<>();
        for (CodeRelation relation : relations) {
            if (!RelationType.COUPLING_TYPES.contains(relation.type())) {
                continue;
            }
            String target = relation.isExternal() ? "external:" + relation.targetName() : relation.targetId();
            if (target.equals(relation.sourceId())) {
                continue;
            }
            targets.computeIfAbsent(relation.sourceId(), key -> new HashSet<>()).add(target);
            if (!relation.isExternal()) {
                sources.computeIfAbsent(relation.targetId(), key -> new HashSet<>()).add(relation.sourceId());
            }
        }
        Map<String, Degree> degrees = new HashMap<>();
        Set<String> ids = new HashSet<>(targets.keySet());
        ids.addAll(sources.keySet());
        for (String id : ids) {
            degrees.put(id, new Degree(sources.getOrDefault(id, Set.of()).size(),
                targets.getOrDefault(id, Set.of()).size()));
        }
        return degrees;
    }

    public List<QualityIssue> detect(String projectId, List<CodeEntity> entities, List<CodeRelation> relations,
                                     Instant now) {
        Map<String, Degree> degrees = degrees(relations);
        List<QualityIssue> issues = new ArrayList<>();
        for (CodeEntity entity : entities) {
            Degree degree = degrees.get(entity.id());
            if (degree == null) {
                continue;
            }
            Severity tight = thresholds.couplingSeverity(degree.max());
            if (tight != null) {
                issues.add(IssueFactory.create(projectId, IssueType.TIGHT_COUPLING, tight, entity.id(), entity,
                    entity.qualifiedName() + " has fan-in " + degree.fanIn() + " and fan-out " + degree.fanOut()
                        + " (limit " + thresholds.couplingMedium() + ")",
                    "Reduce the number of collaborators, for example by introducing a facade",
                    metadata(degree), now));
            }
            if (degree.max() >= thresholds.imbalanceMinDegree() && degree.imbalance() >= thresholds.imbalanceRatio()) {
                Severity severity = degree.imbalance() >= thresholds.imbalanceMediumRatio() ? Severity.MEDIUM : Severity.LOW;
                String side = degree.fanIn() > degree.fanOut() ? "depended upon far more than it depends" : "depends far more than it is depended upon";
                issues.add(IssueFactory.create(projectId, IssueType.COUPLING_IMBALANCE, severity, entity.id(), entity,
                    entity.qualifiedName() + " " + side + " (fan-in " + degree.fanIn() + ", fan-out "
                        + degree.fanOut() + ")",
                    "Check whether the entity mixes stable abstractions with volatile details",
                    metadata(degree), now));
            }
        }
        return issues;
    }

    private static Map<String, Object> metadata(Degree degree) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("fanIn", degree.fanIn());
        metadata.put("fanOut", degree.fanOut());
        metadata.put("ratio", Math.round(degree.imbalance() * 100.0) / 100.0);
        return metadata;
    }
}
