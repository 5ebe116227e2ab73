package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

/**
 * Parses a string into the scalar its consumer (or the transformation's target) expects.
 */
public final class ParseStringTransformer extends ProducerTransformer {
    public ParseStringTransformer(TypeRef sourceTypeRef, @Nullable Transformer consumer) {
        super("parse-string", sourceTypeRef, consumer);
    }

    @Override
    public boolean canFail() {
        return true;
    }

    @Override
    protected Transformer reverseStep(TypeRef sourceTypeRef, @Nullable Transformer continuation) {
        return new StringifyTransformer(sourceTypeRef, continuation);
    }

    @Override
    public Transformer reconstitute(GraphRewriteBuilder builder) {
        return new ParseStringTransformer(builder.reconstituteTypeRef(sourceTypeRef), reconstitute(consumer, builder));
    }
}
