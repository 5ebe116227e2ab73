package io.github.typexform.types;

import io.github.typexform.attrs.CommonAttributes;

import java.util.Collections;
import java.util.List;

public final class PrimitiveType extends Type {
    PrimitiveType(TypeGraph graph, int index, TypeKind kind) {
        super(graph, index, kind);
        if (!kind.isPrimitive()) {
            throw new IllegalArgumentException(kind + " is not a primitive kind");
        }
    }

    /**
     * Get the restriction on the values of this string type.
     *
     * @return The restriction, {@link StringTypes#UNRESTRICTED} for types that aren't strings.
     */
    public StringTypes getStringTypes() {
        return getAttributes().getAttribute(CommonAttributes.STRING_TYPES).orElse(StringTypes.UNRESTRICTED);
    }

    @Override
    public List<TypeRef> getChildRefs() {
        return Collections.emptyList();
    }

    @Override
    public TypeRef reconstitute(GraphRewriteBuilder builder, TypeRef forwardingRef) {
        return builder.getPrimitiveType(kind, builder.reconstituteTypeAttributes(getAttributes()), forwardingRef);
    }

    @Override
    public String debugDescription() {
        return kind.mnemonic;
    }
}
