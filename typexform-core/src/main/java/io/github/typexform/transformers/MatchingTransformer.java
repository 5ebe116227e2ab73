package io.github.typexform.transformers;

import io.github.typexform.types.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * A transformer that only accepts some of its inputs, and runs
 * another transformer on the ones it accepts.
 */
public abstract class MatchingTransformer extends Transformer {
    public final Transformer transformer;

    protected MatchingTransformer(String mnemonic, TypeRef sourceTypeRef, Transformer transformer) {
        super(mnemonic, sourceTypeRef);
        this.transformer = transformer;
    }

    @Override
    public boolean canFail() {
        return true;
    }

    @Override
    public List<Transformer> getChildren() {
        return Collections.singletonList(transformer);
    }
}
