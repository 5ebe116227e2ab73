package io.github.typexform.attrs;

import io.github.typexform.types.GraphRewriteBuilder;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An immutable bag of {@link TypeAttributeKind type attributes}.
 * <p>
 * Bags iterate in the creation order of their kinds, so printing
 * and comparing them is deterministic.
 */
public final class TypeAttributes {
    public static final TypeAttributes EMPTY = new TypeAttributes(Collections.emptySortedMap());

    private final SortedMap<TypeAttributeKind<?>, Object> map;

    private TypeAttributes(SortedMap<TypeAttributeKind<?>, Object> map) {
        this.map = map;
    }

    /**
     * Get the value associated with {@code kind} in this bag, or null if not present.
     *
     * @param kind The attribute kind.
     * @param <T>  The type of the attribute.
     * @return The value.
     */
    @SuppressWarnings("unchecked")
    public <T> @Nullable T getNullable(TypeAttributeKind<T> kind) {
        return (T) map.get(kind);
    }

    /**
     * Get the value associated with {@code kind} in this bag, if any.
     *
     * @param kind The attribute kind.
     * @param <T>  The type of the attribute.
     * @return The value.
     * @see #getNullable(TypeAttributeKind)
     */
    public <T> Optional<T> getAttribute(TypeAttributeKind<T> kind) {
        return Optional.ofNullable(getNullable(kind));
    }

    /**
     * Get the value associated with {@code kind} in this bag, or throw an exception if not present.
     *
     * @param kind The attribute kind.
     * @param <T>  The type of the attribute.
     * @return The value.
     */
    public <T> T getOrThrow(TypeAttributeKind<T> kind) {
        T nullable = getNullable(kind);
        if (nullable != null) return nullable;
        throw new IllegalStateException("Attribute " + kind + " not present");
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public Set<TypeAttributeKind<?>> kinds() {
        return Collections.unmodifiableSet(map.keySet());
    }

    /**
     * Get a bag with {@code kind} set to {@code value}, replacing any previous value.
     *
     * @param kind  The attribute kind.
     * @param value The value.
     * @param <T>   The type of the attribute.
     * @return The new bag.
     */
    public <T> TypeAttributes with(TypeAttributeKind<T> kind, T value) {
        SortedMap<TypeAttributeKind<?>, Object> newMap = new TreeMap<>(map);
        newMap.put(kind, Objects.requireNonNull(value));
        return new TypeAttributes(newMap);
    }

    /**
     * Merge this bag with another, {@link TypeAttributeKind#combine(Object, Object) combining}
     * values present in both.
     *
     * @param other The other bag.
     * @return The merged bag.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public TypeAttributes combine(TypeAttributes other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        SortedMap<TypeAttributeKind<?>, Object> newMap = new TreeMap<>(map);
        for (Map.Entry<TypeAttributeKind<?>, Object> entry : other.map.entrySet()) {
            TypeAttributeKind kind = entry.getKey();
            newMap.merge(kind, entry.getValue(), kind::combine);
        }
        return new TypeAttributes(newMap);
    }

    /**
     * Get the attributes of this bag that take part in type identity.
     *
     * @return The identity attributes.
     */
    public TypeAttributes identityAttributes() {
        return filter(true);
    }

    /**
     * Get the attributes of this bag that don't take part in type identity.
     *
     * @return The non-identity attributes.
     */
    public TypeAttributes withoutIdentity() {
        return filter(false);
    }

    private TypeAttributes filter(boolean inIdentity) {
        SortedMap<TypeAttributeKind<?>, Object> newMap = new TreeMap<>();
        for (Map.Entry<TypeAttributeKind<?>, Object> entry : map.entrySet()) {
            if (entry.getKey().isInIdentity() == inIdentity) {
                newMap.put(entry.getKey(), entry.getValue());
            }
        }
        if (newMap.size() == map.size()) return this;
        return newMap.isEmpty() ? EMPTY : new TypeAttributes(newMap);
    }

    /**
     * Carry every attribute in this bag into a graph that is being rewritten.
     *
     * @param builder The builder of the new graph.
     * @return The reconstituted bag.
     * @see TypeAttributeKind#reconstitute(GraphRewriteBuilder, Object)
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public TypeAttributes reconstitute(GraphRewriteBuilder builder) {
        if (isEmpty()) return this;
        SortedMap<TypeAttributeKind<?>, Object> newMap = new TreeMap<>();
        for (Map.Entry<TypeAttributeKind<?>, Object> entry : map.entrySet()) {
            TypeAttributeKind kind = entry.getKey();
            newMap.put(kind, kind.reconstitute(builder, entry.getValue()));
        }
        return new TypeAttributes(newMap);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return map.equals(((TypeAttributes) o).map);
    }

    @Override
    public int hashCode() {
        return map.hashCode();
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
