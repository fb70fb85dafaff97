package com.codegraph.core.normalize;

import com.codegraph.core.model.EntityKind;
import com.codegraph.core.model.RelationType;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps extractor vocabulary onto the unified {@link EntityKind} and {@link RelationType} enums.
 *
 * <p>Lookups are case-insensitive. Unknown words yield an empty result so the caller can
 * fall back ({@link EntityKind#UNKNOWN}, {@link RelationType#USES}) and report a warning.
 */
public final class VocabularyMapper {

    private static final Map<String, EntityKind> KINDS = new HashMap<>();
    private static final Map<String, RelationType> RELATIONS = new HashMap<>();

    static {
        kinds(EntityKind.MODULE, "module", "file", "package", "namespace");
        kinds(EntityKind.CLASS, "class", "struct", "actor", "record", "extension", "object");
        kinds(EntityKind.INTERFACE, "interface", "protocol", "type_alias", "trait", "annotation");
        kinds(EntityKind.ENUM, "enum");
        kinds(EntityKind.FUNCTION, "function", "hook", "composable", "lambda");
        kinds(EntityKind.METHOD, "method", "constructor", "init", "deinit", "subscript");
        kinds(EntityKind.PROPERTY, "property", "field", "variable", "constant", "ref", "prop", "data",
            "computed", "enum_constant", "record_component");
        kinds(EntityKind.COMPONENT, "component", "react_component", "vue_component");

        relations(RelationType.INHERITS, "extends", "inherits", "conforms");
        relations(RelationType.IMPLEMENTS, "implements");
        relations(RelationType.CALLS, "calls", "invokes");
        relations(RelationType.IMPORTS, "imports", "requires");
        relations(RelationType.USES, "uses", "instantiates", "references", "template_usage", "extends_type");
        relations(RelationType.DEFINES, "declares", "defines");
        relations(RelationType.CONTAINS, "contains");
    }

    private VocabularyMapper() {
        // Utility class
    }

    private static void kinds(EntityKind kind, String... words) {
        for (String word : words) {
            KINDS.put(word, kind);
        }
    }

    private static void relations(RelationType type, String... words) {
        for (String word : words) {
            RELATIONS.put(word, type);
        }
    }

    public static Optional<EntityKind> entityKind(String word) {
        return word == null ? Optional.empty() : Optional.ofNullable(KINDS.get(word.trim().toLowerCase(Locale.ROOT)));
    }

    public static Optional<RelationType> relationType(String word) {
        return word == null ? Optional.empty() : Optional.ofNullable(RELATIONS.get(word.trim().toLowerCase(Locale.ROOT)));
    }
}
