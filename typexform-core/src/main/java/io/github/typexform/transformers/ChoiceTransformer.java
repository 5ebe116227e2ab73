package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tries each of its alternatives in order, and takes the result of the first that accepts the input.
 */
public final class ChoiceTransformer extends Transformer {
    public final List<Transformer> transformers;

    public ChoiceTransformer(TypeRef sourceTypeRef, List<Transformer> transformers) {
        super("choice", sourceTypeRef);
        if (transformers.isEmpty()) {
            throw new IllegalArgumentException("A choice must have at least one alternative");
        }
        this.transformers = Collections.unmodifiableList(new ArrayList<>(transformers));
    }

    @Override
    public boolean canFail() {
        for (Transformer transformer : transformers) {
            if (!transformer.canFail()) return false;
        }
        return true;
    }

    @Override
    public List<Transformer> getChildren() {
        return transformers;
    }

    @Override
    public Transformer reverse(TypeRef targetTypeRef, @Nullable Transformer continuation) {
        List<Transformer> reversed = new ArrayList<>();
        for (Transformer transformer : transformers) {
            reversed.add(transformer.reverse(targetTypeRef, continuation));
        }

        // if every alternative matches the same union member, match it once
        TypeRef memberTypeRef = null;
        List<Transformer> memberTransformers = new ArrayList<>();
        for (Transformer transformer : reversed) {
            if (!(transformer instanceof UnionMemberMatchTransformer)) {
                memberTypeRef = null;
                break;
            }
            UnionMemberMatchTransformer matcher = (UnionMemberMatchTransformer) transformer;
            if (memberTypeRef == null) {
                memberTypeRef = matcher.memberTypeRef;
            } else if (!memberTypeRef.equals(matcher.memberTypeRef)) {
                memberTypeRef = null;
                break;
            }
            memberTransformers.add(matcher.transformer);
        }
        if (memberTypeRef != null && memberTransformers.size() > 1) {
            return new UnionMemberMatchTransformer(
                    targetTypeRef,
                    new ChoiceTransformer(memberTransformers.get(0).sourceTypeRef, memberTransformers),
                    memberTypeRef
            );
        }
        return new ChoiceTransformer(targetTypeRef, reversed);
    }

    @Override
    public Transformer reconstitute(GraphRewriteBuilder builder) {
        List<Transformer> newTransformers = new ArrayList<>();
        for (Transformer transformer : transformers) {
            newTransformers.add(transformer.reconstitute(builder));
        }
        return new ChoiceTransformer(builder.reconstituteTypeRef(sourceTypeRef), newTransformers);
    }
}
