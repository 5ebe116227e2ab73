package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * Accepts only union values tagged as a given member, and runs its transformer on the untagged value.
 */
public final class UnionMemberMatchTransformer extends MatchingTransformer {
    public final TypeRef memberTypeRef;

    public UnionMemberMatchTransformer(TypeRef sourceTypeRef, Transformer transformer, TypeRef memberTypeRef) {
        super("match-union-member", sourceTypeRef, transformer);
        this.memberTypeRef = memberTypeRef;
    }

    @Override
    public List<TypeRef> getTypeRefs() {
        return Arrays.asList(sourceTypeRef, memberTypeRef);
    }

    @Override
    public Transformer reverse(TypeRef targetTypeRef, @Nullable Transformer continuation) {
        if (continuation != null) {
            throw new IllegalStateException("Reversing a union member matcher cannot have a continuation");
        }
        return transformer.reverse(targetTypeRef, new UnionInstantiationTransformer(memberTypeRef));
    }

    @Override
    public Transformer reconstitute(GraphRewriteBuilder builder) {
        return new UnionMemberMatchTransformer(
                builder.reconstituteTypeRef(sourceTypeRef),
                transformer.reconstitute(builder),
                builder.reconstituteTypeRef(memberTypeRef)
        );
    }

    @Override
    protected String details() {
        return "member " + memberTypeRef;
    }
}
