package io.github.typexform.attrs;

import io.github.typexform.types.GraphRewriteBuilder;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BinaryOperator;

/**
 * A kind of type attribute, that can be associated with a value (of type {@code T})
 * in a {@link TypeAttributes} bag.
 * <p>
 * Note: The implementation of {@link #compareTo(TypeAttributeKind)} depends
 * on the global order in which kinds are created. Bags iterate in that order,
 * so it must not depend on anything but class initialization order.
 *
 * @param <T> The type of the attribute values.
 */
public class TypeAttributeKind<T> implements Comparable<TypeAttributeKind<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;
    private final BinaryOperator<T> combiner;
    private final boolean inIdentity;

    protected TypeAttributeKind(Class<T> type, String name, BinaryOperator<T> combiner, boolean inIdentity) {
        this.type = type;
        this.name = name;
        this.combiner = combiner;
        this.inIdentity = inIdentity;
    }

    /**
     * Creates a new attribute kind.
     * <p>
     * The signature is the same trick as everywhere else: classes are not generic,
     * so {@code T} here cannot refer to a generic class, but {@code R} can.
     *
     * @param type       The most specific superclass of the type of the attribute.
     * @param name       The name of the attribute kind.
     * @param combiner   How two values of the attribute are merged. Must be commutative and associative.
     * @param inIdentity Whether the attribute takes part in the structural identity of a type.
     * @param <T>        The type of the class.
     * @param <R>        The type of the attribute.
     * @return The new attribute kind.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> TypeAttributeKind<R> create(
            Class<T> type,
            String name,
            BinaryOperator<R> combiner,
            boolean inIdentity
    ) {
        return new TypeAttributeKind<>((Class<R>) type, name, combiner, inIdentity);
    }

    public Class<T> getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    /**
     * Whether two types that differ only in this attribute are different types.
     *
     * @return Whether this kind is part of type identity.
     */
    public boolean isInIdentity() {
        return inIdentity;
    }

    /**
     * Merge two values of this attribute.
     *
     * @param lhs The first value.
     * @param rhs The second value.
     * @return The merged value.
     */
    public T combine(T lhs, T rhs) {
        if (Objects.equals(lhs, rhs)) return lhs;
        return combiner.apply(lhs, rhs);
    }

    /**
     * Carry a value of this attribute into a graph that is being rewritten.
     * <p>
     * Values that refer to types must override this to map their handles,
     * the default returns the value unchanged.
     *
     * @param builder The builder of the new graph.
     * @param value   The value in the old graph.
     * @return The value in the new graph.
     */
    public T reconstitute(GraphRewriteBuilder builder, T value) {
        return value;
    }

    /**
     * Get the value of this attribute in the given bag.
     *
     * @param attributes The bag.
     * @return The value, if any.
     * @see TypeAttributes#getAttribute(TypeAttributeKind)
     */
    public Optional<T> getIn(TypeAttributes attributes) {
        return attributes.getAttribute(this);
    }

    /**
     * Make a bag holding only this attribute.
     *
     * @param value The value.
     * @return The bag.
     */
    public TypeAttributes makeAttributes(T value) {
        return TypeAttributes.EMPTY.with(this, value);
    }

    @Override
    public int compareTo(@NotNull TypeAttributeKind<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name;
    }
}
