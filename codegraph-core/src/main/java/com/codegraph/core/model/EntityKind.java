package com.codegraph.core.model;

/**
 * Unified vocabulary of code entity kinds shared by every language.
 *
 * <p>Extractors report their own vocabulary ({@code struct}, {@code protocol}, {@code hook}, ...);
 * the normalizer maps it onto these values.
 */
public enum EntityKind {
    MODULE,
    CLASS,
    INTERFACE,
    ENUM,
    FUNCTION,
    METHOD,
    PROPERTY,
    COMPONENT,
    UNKNOWN;

    /**
     * Returns true for kinds that own methods (classes, interfaces, enums, components).
     *
     * @return true if entities of this kind are type-like containers
     */
    public boolean isTypeLike() {
        return this == CLASS || this == INTERFACE || this == ENUM || this == COMPONENT;
    }

    /**
     * Returns true for executable kinds.
     *
     * @return true for functions and methods
     */
    public boolean isCallable() {
        return this == FUNCTION || this == METHOD;
    }
}
