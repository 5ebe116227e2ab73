package io.github.typexform.types;

import java.util.Collections;
import java.util.List;

public final class MapType extends Type {
    private final TypeRef values;

    MapType(TypeGraph graph, int index, TypeRef values) {
        super(graph, index, TypeKind.MAP);
        this.values = values;
    }

    public TypeRef getValuesRef() {
        return values;
    }

    public Type getValues() {
        return graph.typeAt(values);
    }

    @Override
    public List<TypeRef> getChildRefs() {
        return Collections.singletonList(values);
    }

    @Override
    public TypeRef reconstitute(GraphRewriteBuilder builder, TypeRef forwardingRef) {
        return builder.getMapType(
                builder.reconstituteTypeAttributes(getAttributes()),
                builder.reconstituteTypeRef(values),
                forwardingRef
        );
    }

    @Override
    public String debugDescription() {
        return "map<" + refString(values) + ">";
    }
}
