package io.github.typexform.types;

import java.util.EnumMap;
import java.util.Map;

/**
 * Which of the transformed string kinds a target can represent, and which it
 * represents as plain strings instead.
 */
public final class StringTypeMapping {
    /**
     * A mapping that keeps every transformed string kind.
     */
    public static final StringTypeMapping IDENTITY = new Builder().build();

    /**
     * A mapping that represents every transformed string kind as a plain string.
     */
    public static final StringTypeMapping ALL_STRINGS = allStrings();

    private final Map<TypeKind, TypeKind> mapping;

    private StringTypeMapping(Map<TypeKind, TypeKind> mapping) {
        this.mapping = mapping;
    }

    private static StringTypeMapping allStrings() {
        Builder builder = new Builder();
        for (TypeKind kind : TypeKind.values()) {
            if (kind.isTransformedString()) {
                builder.map(kind, TypeKind.STRING);
            }
        }
        return builder.build();
    }

    /**
     * Get the kind that {@code kind} is represented as.
     *
     * @param kind The kind.
     * @return The kind it is represented as, {@code kind} itself if it is kept.
     */
    public TypeKind get(TypeKind kind) {
        return mapping.getOrDefault(kind, kind);
    }

    @Override
    public String toString() {
        return mapping.toString();
    }

    public static class Builder {
        private final Map<TypeKind, TypeKind> mapping = new EnumMap<>(TypeKind.class);

        public Builder map(TypeKind from, TypeKind to) {
            if (!from.isTransformedString()) {
                throw new IllegalArgumentException(from + " is not a transformed string kind");
            }
            if (to != from && to != TypeKind.STRING) {
                throw new IllegalArgumentException(from + " can only be represented as itself or as a string, not " + to);
            }
            mapping.put(from, to);
            return this;
        }

        public StringTypeMapping build() {
            return new StringTypeMapping(new EnumMap<>(mapping));
        }
    }
}
