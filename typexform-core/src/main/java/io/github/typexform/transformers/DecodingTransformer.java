package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

/**
 * Decodes a raw value as its source type.
 */
public final class DecodingTransformer extends ProducerTransformer {
    public DecodingTransformer(TypeRef sourceTypeRef, @Nullable Transformer consumer) {
        super("decode", sourceTypeRef, consumer);
    }

    @Override
    protected Transformer reverseStep(TypeRef sourceTypeRef, @Nullable Transformer continuation) {
        if (continuation != null) {
            throw new IllegalStateException("Reversing a decoding transformer cannot have a continuation");
        }
        return new EncodingTransformer(sourceTypeRef);
    }

    @Override
    public Transformer reconstitute(GraphRewriteBuilder builder) {
        return new DecodingTransformer(builder.reconstituteTypeRef(sourceTypeRef), reconstitute(consumer, builder));
    }
}
