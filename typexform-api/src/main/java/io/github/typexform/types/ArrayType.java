package io.github.typexform.types;

import java.util.Collections;
import java.util.List;

public final class ArrayType extends Type {
    private final TypeRef items;

    ArrayType(TypeGraph graph, int index, TypeRef items) {
        super(graph, index, TypeKind.ARRAY);
        this.items = items;
    }

    public TypeRef getItemsRef() {
        return items;
    }

    public Type getItems() {
        return graph.typeAt(items);
    }

    @Override
    public List<TypeRef> getChildRefs() {
        return Collections.singletonList(items);
    }

    @Override
    public TypeRef reconstitute(GraphRewriteBuilder builder, TypeRef forwardingRef) {
        return builder.getArrayType(
                builder.reconstituteTypeAttributes(getAttributes()),
                builder.reconstituteTypeRef(items),
                forwardingRef
        );
    }

    @Override
    public String debugDescription() {
        return "array<" + refString(items) + ">";
    }
}
