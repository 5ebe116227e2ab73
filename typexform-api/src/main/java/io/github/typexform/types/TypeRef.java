package io.github.typexform.types;

/**
 * A handle to a slot in a {@link TypeGraph}.
 * <p>
 * A handle may be handed out before its slot is filled, which is how cyclic
 * types are built. Several handles may end up resolving to the same type,
 * so compare the types they resolve to, or their {@link TypeGraph#canonical(TypeRef) canonical} handles,
 * rather than the handles themselves.
 */
public final class TypeRef implements Comparable<TypeRef> {
    final int serial;
    final int index;

    TypeRef(int serial, int index) {
        this.serial = serial;
        this.index = index;
    }

    /**
     * Get the slot index of this handle in its graph.
     *
     * @return The index.
     */
    public int getIndex() {
        return index;
    }

    @Override
    public int compareTo(TypeRef o) {
        int cmp = Integer.compare(serial, o.serial);
        return cmp != 0 ? cmp : Integer.compare(index, o.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeRef typeRef = (TypeRef) o;
        return serial == typeRef.serial && index == typeRef.index;
    }

    @Override
    public int hashCode() {
        return 31 * serial + index;
    }

    @Override
    public String toString() {
        return "#" + index;
    }
}
