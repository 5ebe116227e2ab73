package io.github.typexform.types;

import java.util.*;

public final class EnumType extends Type {
    private final Set<String> cases;

    EnumType(TypeGraph graph, int index, Collection<String> cases) {
        super(graph, index, TypeKind.ENUM);
        this.cases = Collections.unmodifiableSet(new LinkedHashSet<>(cases));
    }

    /**
     * Get the cases of this enum, in the order they were given.
     * <p>
     * That order carries no meaning; anything that needs a stable order must sort.
     *
     * @return The cases.
     */
    public Set<String> getCases() {
        return cases;
    }

    @Override
    public List<TypeRef> getChildRefs() {
        return Collections.emptyList();
    }

    @Override
    public TypeRef reconstitute(GraphRewriteBuilder builder, TypeRef forwardingRef) {
        return builder.getEnumType(builder.reconstituteTypeAttributes(getAttributes()), cases, forwardingRef);
    }

    @Override
    public String debugDescription() {
        return "enum" + new TreeSet<>(cases);
    }
}
