package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Decodes every item of an array with an item transformer.
 */
public final class ArrayDecodingTransformer extends ProducerTransformer {
    public final TypeRef itemTargetTypeRef;
    public final Transformer itemTransformer;

    /**
     * @param sourceTypeRef     The type of the raw array.
     * @param consumer          What to run on the decoded array.
     * @param itemTargetTypeRef The type each item is decoded into.
     * @param itemTransformer   The transformer to decode each item with.
     */
    public ArrayDecodingTransformer(
            TypeRef sourceTypeRef,
            @Nullable Transformer consumer,
            TypeRef itemTargetTypeRef,
            Transformer itemTransformer
    ) {
        super("decode-array", sourceTypeRef, consumer);
        this.itemTargetTypeRef = itemTargetTypeRef;
        this.itemTransformer = itemTransformer;
    }

    @Override
    public boolean canFail() {
        return itemTransformer.canFail() || super.canFail();
    }

    @Override
    public List<Transformer> getChildren() {
        List<Transformer> children = new ArrayList<>();
        children.add(itemTransformer);
        children.addAll(super.getChildren());
        return children;
    }

    @Override
    public List<TypeRef> getTypeRefs() {
        return Arrays.asList(sourceTypeRef, itemTargetTypeRef);
    }

    @Override
    protected Transformer reverseStep(TypeRef sourceTypeRef, @Nullable Transformer continuation) {
        return new ArrayEncodingTransformer(
                sourceTypeRef,
                continuation,
                itemTransformer.sourceTypeRef,
                itemTransformer.reverse(itemTargetTypeRef, null)
        );
    }

    @Override
    public Transformer reconstitute(GraphRewriteBuilder builder) {
        return new ArrayDecodingTransformer(
                builder.reconstituteTypeRef(sourceTypeRef),
                reconstitute(consumer, builder),
                builder.reconstituteTypeRef(itemTargetTypeRef),
                itemTransformer.reconstitute(builder)
        );
    }

    @Override
    protected String details() {
        return "items " + itemTargetTypeRef;
    }
}
