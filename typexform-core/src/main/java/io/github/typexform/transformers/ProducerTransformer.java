package io.github.typexform.transformers;

import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A transformer that produces a value, and passes it to an optional consumer.
 */
public abstract class ProducerTransformer extends Transformer {
    public final @Nullable Transformer consumer;

    protected ProducerTransformer(String mnemonic, TypeRef sourceTypeRef, @Nullable Transformer consumer) {
        super(mnemonic, sourceTypeRef);
        this.consumer = consumer;
    }

    @Override
    public boolean canFail() {
        return consumer != null && consumer.canFail();
    }

    @Override
    public List<Transformer> getChildren() {
        return consumer == null ? Collections.emptyList() : Collections.singletonList(consumer);
    }

    /**
     * Build the inverse of this step alone.
     *
     * @param sourceTypeRef The type the inverse consumes.
     * @param continuation  What the inverse continues into.
     * @return The inverse step.
     */
    protected abstract Transformer reverseStep(TypeRef sourceTypeRef, @Nullable Transformer continuation);

    @Override
    public Transformer reverse(TypeRef targetTypeRef, @Nullable Transformer continuation) {
        if (consumer == null) {
            return reverseStep(targetTypeRef, continuation);
        }
        return consumer.reverse(targetTypeRef, reverseStep(consumer.sourceTypeRef, continuation));
    }
}
