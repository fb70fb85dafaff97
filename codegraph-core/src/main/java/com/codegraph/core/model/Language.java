package com.codegraph.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Source languages understood by the engine.
 */
public enum Language {
    JAVA("java"),
    PYTHON("python"),
    JAVASCRIPT("javascript"),
    TYPESCRIPT("typescript"),
    SWIFT("swift"),
    VUE("vue");

    private final String id;

    Language(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Looks up a language by its identifier, ignoring case.
     *
     * @param id language identifier such as {@code "python"}
     * @return matching language, or empty if unknown
     */
    public static Optional<Language> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(language -> language.id.equals(normalized) || language.name().equalsIgnoreCase(normalized))
            .findFirst();
    }
}
