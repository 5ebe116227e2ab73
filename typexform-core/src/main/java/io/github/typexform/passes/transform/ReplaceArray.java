package io.github.typexform.passes.transform;

import io.github.typexform.attrs.TypeAttributes;
import io.github.typexform.transformers.ArrayDecodingTransformer;
import io.github.typexform.transformers.DecodingTransformer;
import io.github.typexform.transformers.Transformer;
import io.github.typexform.types.*;

/**
 * Replaces an array with an array of {@link TypeKind#ANY any}, whose items are decoded
 * into the (reconstituted) item type of the original.
 */
public class ReplaceArray extends ReplacementStrategy<ArrayType> {
    public ReplaceArray(boolean debugPrintTransformations) {
        super(debugPrintTransformations);
    }

    @Override
    public TypeRef replace(ArrayType arrayType, GraphRewriteBuilder builder, TypeRef forwardingRef) {
        TypeRef anyType = builder.getPrimitiveType(TypeKind.ANY);
        TypeRef anyArrayType = builder.getArrayType(TypeAttributes.EMPTY, anyType);
        TypeRef reconstitutedItems = builder.reconstituteType(arrayType.getItems());
        Transformer transformer = new ArrayDecodingTransformer(
                anyArrayType,
                null,
                reconstitutedItems,
                new DecodingTransformer(anyType, null)
        );

        TypeRef reconstitutedArray = builder.getArrayType(
                builder.reconstituteTypeAttributes(arrayType.getAttributes()),
                reconstitutedItems
        );
        TypeAttributes attributes = transformationAttributes(builder, reconstitutedArray, transformer);
        return builder.getArrayType(attributes, anyType, forwardingRef);
    }
}
