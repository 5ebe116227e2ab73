package io.github.typexform.types;

import io.github.typexform.attrs.TypeAttributes;

import java.util.ArrayList;
import java.util.List;

/**
 * A node in a {@link TypeGraph}.
 * <p>
 * Types refer to their children by {@link TypeRef handle}, and resolve them through
 * their graph, so a type may (transitively) refer to itself. There is exactly one
 * {@link Type} object per canonical slot of a graph, so types compare by identity.
 */
public abstract class Type {
    protected final TypeGraph graph;
    protected final int index;
    public final TypeKind kind;

    protected Type(TypeGraph graph, int index, TypeKind kind) {
        this.graph = graph;
        this.index = index;
        this.kind = kind;
    }

    public TypeKind getKind() {
        return kind;
    }

    public TypeGraph getGraph() {
        return graph;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Get the canonical handle of this type.
     *
     * @return The handle.
     */
    public TypeRef getRef() {
        return graph.refAt(index);
    }

    public TypeAttributes getAttributes() {
        return graph.attributesOf(this);
    }

    /**
     * Get the handles of the types this type refers to directly.
     *
     * @return The child handles, in a deterministic order.
     */
    public abstract List<TypeRef> getChildRefs();

    public List<Type> getChildren() {
        List<Type> children = new ArrayList<>();
        for (TypeRef ref : getChildRefs()) {
            children.add(graph.typeAt(ref));
        }
        return children;
    }

    /**
     * Build this type again in a graph that is being rewritten, with its children
     * and attributes reconstituted.
     *
     * @param builder       The builder of the new graph.
     * @param forwardingRef The handle the new type must be placed at.
     * @return {@code forwardingRef}.
     */
    public abstract TypeRef reconstitute(GraphRewriteBuilder builder, TypeRef forwardingRef);

    /**
     * Describe the structure of this type, without attributes.
     *
     * @return The description.
     */
    public abstract String debugDescription();

    protected String refString(TypeRef ref) {
        return graph.canonical(ref).toString();
    }

    @Override
    public String toString() {
        return kind + "#" + index;
    }
}
