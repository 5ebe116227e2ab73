package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

/**
 * Ignores its input, and produces a fixed string.
 */
public final class StringProducerTransformer extends ProducerTransformer {
    public final String result;

    public StringProducerTransformer(TypeRef sourceTypeRef, @Nullable Transformer consumer, String result) {
        super("produce-string", sourceTypeRef, consumer);
        this.result = result;
    }

    @Override
    protected Transformer reverseStep(TypeRef sourceTypeRef, @Nullable Transformer continuation) {
        if (continuation == null) {
            throw new IllegalStateException("Reversing a string producer transformer must have a continuation");
        }
        return new StringMatchTransformer(sourceTypeRef, continuation, result);
    }

    @Override
    public Transformer reconstitute(GraphRewriteBuilder builder) {
        return new StringProducerTransformer(
                builder.reconstituteTypeRef(sourceTypeRef),
                reconstitute(consumer, builder),
                result
        );
    }

    @Override
    protected String details() {
        return '"' + result + '"';
    }
}
