package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

/**
 * Accepts only inputs equal to a fixed string.
 */
public final class StringMatchTransformer extends MatchingTransformer {
    public final String stringCase;

    public StringMatchTransformer(TypeRef sourceTypeRef, Transformer transformer, String stringCase) {
        super("match-string", sourceTypeRef, transformer);
        this.stringCase = stringCase;
    }

    @Override
    public Transformer reverse(TypeRef targetTypeRef, @Nullable Transformer continuation) {
        return transformer.reverse(
                targetTypeRef,
                new StringProducerTransformer(transformer.sourceTypeRef, continuation, stringCase)
        );
    }

    @Override
    public Transformer reconstitute(GraphRewriteBuilder builder) {
        return new StringMatchTransformer(
                builder.reconstituteTypeRef(sourceTypeRef),
                transformer.reconstitute(builder),
                stringCase
        );
    }

    @Override
    protected String details() {
        return '"' + stringCase + '"';
    }
}
