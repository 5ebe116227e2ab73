package io.github.typexform.passes.transform;

import io.github.typexform.attrs.TypeAttributes;
import io.github.typexform.transformers.DecodingTransformer;
import io.github.typexform.transformers.ParseStringTransformer;
import io.github.typexform.transformers.Transformer;
import io.github.typexform.types.*;

/**
 * Replaces a transformed string type, such as an integer string, with an unrestricted
 * string that is parsed when decoded.
 */
public class ReplaceTransformedString extends ReplacementStrategy<PrimitiveType> {
    public ReplaceTransformedString(boolean debugPrintTransformations) {
        super(debugPrintTransformations);
    }

    @Override
    public TypeRef replace(PrimitiveType type, GraphRewriteBuilder builder, TypeRef forwardingRef) {
        if (!type.kind.isTransformedString()) {
            throw new IllegalStateException("Cannot make a string parsing transformation for " + type);
        }
        TypeKind targetKind = type.kind.transformedStringTarget();
        if (targetKind == null) targetKind = type.kind;

        TypeRef stringType = builder.getStringType(TypeAttributes.EMPTY, StringTypes.UNRESTRICTED);
        Transformer transformer = new DecodingTransformer(
                stringType,
                new ParseStringTransformer(stringType, null)
        );
        TypeRef target = builder.getPrimitiveType(
                targetKind,
                builder.reconstituteTypeAttributes(type.getAttributes())
        );
        TypeAttributes attributes = transformationAttributes(builder, target, transformer);
        return builder.getStringType(attributes, StringTypes.UNRESTRICTED, forwardingRef);
    }
}
