package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

/**
 * Formats a scalar as a string.
 */
public final class StringifyTransformer extends ProducerTransformer {
    public StringifyTransformer(TypeRef sourceTypeRef, @Nullable Transformer consumer) {
        super("stringify", sourceTypeRef, consumer);
    }

    @Override
    protected Transformer reverseStep(TypeRef sourceTypeRef, @Nullable Transformer continuation) {
        return new ParseStringTransformer(sourceTypeRef, continuation);
    }

    @Override
    public Transformer reconstitute(GraphRewriteBuilder builder) {
        return new StringifyTransformer(builder.reconstituteTypeRef(sourceTypeRef), reconstitute(consumer, builder));
    }
}
