package io.github.typexform.types;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A union of types, with at most one member of each kind.
 */
public final class UnionType extends Type {
    private final SortedSet<TypeRef> memberRefs;

    UnionType(TypeGraph graph, int index, Collection<TypeRef> memberRefs) {
        super(graph, index, TypeKind.UNION);
        this.memberRefs = Collections.unmodifiableSortedSet(new TreeSet<>(memberRefs));
    }

    public SortedSet<TypeRef> getMemberRefs() {
        return memberRefs;
    }

    /**
     * Get the members of this union, keyed and ordered by kind.
     *
     * @return The members.
     */
    public SortedMap<TypeKind, Type> getMembers() {
        SortedMap<TypeKind, Type> members = new TreeMap<>();
        for (TypeRef ref : memberRefs) {
            Type member = graph.typeAt(ref);
            Type prev = members.put(member.kind, member);
            if (prev != null && prev != member) {
                throw new IllegalStateException(this + " has more than one member of kind " + member.kind);
            }
        }
        return members;
    }

    public @Nullable Type findMember(TypeKind kind) {
        return getMembers().get(kind);
    }

    /**
     * Get the members of this union that are represented as JSON strings:
     * the primitive string kinds and enums.
     *
     * @return The string members, ordered by kind.
     */
    public List<Type> getStringTypeMembers() {
        List<Type> ret = new ArrayList<>();
        for (Type member : getMembers().values()) {
            if (member.kind.isPrimitiveString() || member.kind == TypeKind.ENUM) {
                ret.add(member);
            }
        }
        return ret;
    }

    @Override
    public List<TypeRef> getChildRefs() {
        return new ArrayList<>(memberRefs);
    }

    @Override
    public TypeRef reconstitute(GraphRewriteBuilder builder, TypeRef forwardingRef) {
        List<TypeRef> newMembers = new ArrayList<>();
        for (TypeRef memberRef : memberRefs) {
            newMembers.add(builder.reconstituteTypeRef(memberRef));
        }
        return builder.getUnionType(builder.reconstituteTypeAttributes(getAttributes()), newMembers, forwardingRef);
    }

    @Override
    public String debugDescription() {
        StringJoiner sj = new StringJoiner(", ", "union{", "}");
        for (TypeRef ref : memberRefs) {
            sj.add(refString(ref));
        }
        return sj.toString();
    }
}
