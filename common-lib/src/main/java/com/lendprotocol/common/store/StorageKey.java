package com.lendprotocol.common.store;

import java.util.Objects;

/**
 * Structured, collision-free storage key: {@code namespace:entity[:qualifier]}.
 *
 * <p>Namespace and entity are fixed identifiers and may not contain {@code ':'}; the
 * qualifier (proposal id, address) is always the last segment, so two keys render to the
 * same string only if all three parts are equal.
 *
 * <p>Each subsystem declares its own key family ({@code GovernanceKeys}, {@code OracleKeys},
 * {@link ProtocolKeys}) on top of this type.
 */
public record StorageKey(String namespace, String entity, String qualifier) {

    private static final char SEPARATOR = ':';

    public StorageKey {
        requireSegment(namespace, "namespace");
        requireSegment(entity, "entity");
        if (qualifier != null && qualifier.isEmpty()) {
            throw new IllegalArgumentException("qualifier must not be empty");
        }
    }

    public static StorageKey of(String namespace, String entity) {
        return new StorageKey(namespace, entity, null);
    }

    public static StorageKey of(String namespace, String entity, Object qualifier) {
        return new StorageKey(namespace, entity, String.valueOf(Objects.requireNonNull(qualifier, "qualifier")));
    }

    public String render() {
        String base = namespace + SEPARATOR + entity;
        return qualifier == null ? base : base + SEPARATOR + qualifier;
    }

    @Override
    public String toString() {
        return render();
    }

    private static void requireSegment(String segment, String name) {
        if (segment == null || segment.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        if (segment.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException(name + " must not contain '" + SEPARATOR + "': " + segment);
        }
    }
}
