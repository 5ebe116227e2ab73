package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * Tags a value of a union member's type as that member of the union.
 * Always the last step of a chain.
 */
public final class UnionInstantiationTransformer extends Transformer {
    public UnionInstantiationTransformer(TypeRef memberTypeRef) {
        super("instantiate-union", memberTypeRef);
    }

    @Override
    public boolean canFail() {
        return false;
    }

    @Override
    public List<Transformer> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public Transformer reverse(TypeRef targetTypeRef, @Nullable Transformer continuation) {
        return new UnionMemberMatchTransformer(
                targetTypeRef,
                continuation == null ? new EncodingTransformer(sourceTypeRef) : continuation,
                sourceTypeRef
        );
    }

    @Override
    public Transformer reconstitute(GraphRewriteBuilder builder) {
        return new UnionInstantiationTransformer(builder.reconstituteTypeRef(sourceTypeRef));
    }
}
