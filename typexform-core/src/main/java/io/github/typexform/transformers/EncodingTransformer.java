package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

/**
 * Encodes a value of its source type back into its raw form. Always the last step of a chain.
 */
public final class EncodingTransformer extends ProducerTransformer {
    public EncodingTransformer(TypeRef sourceTypeRef) {
        super("encode", sourceTypeRef, null);
    }

    @Override
    protected Transformer reverseStep(TypeRef sourceTypeRef, @Nullable Transformer continuation) {
        return new DecodingTransformer(sourceTypeRef, continuation);
    }

    @Override
    public Transformer reconstitute(GraphRewriteBuilder builder) {
        return new EncodingTransformer(builder.reconstituteTypeRef(sourceTypeRef));
    }
}
