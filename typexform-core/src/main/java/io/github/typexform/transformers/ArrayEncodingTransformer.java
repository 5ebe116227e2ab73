package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Encodes every item of an array with an item transformer.
 */
public final class ArrayEncodingTransformer extends ProducerTransformer {
    public final TypeRef itemTargetTypeRef;
    public final Transformer itemTransformer;

    /**
     * @param sourceTypeRef     The type of the decoded array.
     * @param consumer          What to run on the encoded array.
     * @param itemTargetTypeRef The type each item is encoded into.
     * @param itemTransformer   The transformer to encode each item with.
     */
    public ArrayEncodingTransformer(
            TypeRef sourceTypeRef,
            @Nullable Transformer consumer,
            TypeRef itemTargetTypeRef,
            Transformer itemTransformer
    ) {
        super("encode-array", sourceTypeRef, consumer);
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
        return new ArrayDecodingTransformer(
                sourceTypeRef,
                continuation,
                itemTransformer.sourceTypeRef,
                itemTransformer.reverse(itemTargetTypeRef, null)
        );
    }

    @Override
    public Transformer reconstitute(GraphRewriteBuilder builder) {
        return new ArrayEncodingTransformer(
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
