package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A node of the transformer IR: a single step of decoding a raw value into
 * a typed one, or of encoding it back.
 * <p>
 * Transformers are immutable. Most continue into another transformer that
 * consumes their output; a transformer with nothing to continue into produces
 * the final value of its {@link Transformation}.
 */
public abstract class Transformer {
    public final String mnemonic;
    public final TypeRef sourceTypeRef;

    protected Transformer(String mnemonic, TypeRef sourceTypeRef) {
        this.mnemonic = mnemonic;
        this.sourceTypeRef = sourceTypeRef;
    }

    /**
     * Get the type of the values this transformer consumes.
     *
     * @return The source type.
     */
    public TypeRef getSourceTypeRef() {
        return sourceTypeRef;
    }

    /**
     * Whether this transformer, or anything it continues into, can reject its input.
     *
     * @return Whether this can fail.
     */
    public abstract boolean canFail();

    /**
     * Get the transformers this one runs, in order.
     *
     * @return The children.
     */
    public abstract List<Transformer> getChildren();

    /**
     * Get every type this node refers to, not including its children.
     *
     * @return The types.
     */
    public List<TypeRef> getTypeRefs() {
        return Collections.singletonList(sourceTypeRef);
    }

    /**
     * Build the transformer that undoes this one.
     * <p>
     * A chain of transformers is reversed back to front: the reverse of this
     * transformer is built first, with {@code continuation} after it, and then
     * passed as the continuation of the reverse of whatever this one continues into.
     *
     * @param targetTypeRef The type the reversed transformer consumes, i.e. the type
     *                      this transformer (chain) produces.
     * @param continuation  What should run after the reversed transformer, if anything.
     * @return The reversed transformer.
     */
    public abstract Transformer reverse(TypeRef targetTypeRef, @Nullable Transformer continuation);

    /**
     * Carry this transformer into a graph that is being rewritten.
     *
     * @param builder The builder of the new graph.
     * @return The transformer, referring to types in the new graph.
     */
    public abstract Transformer reconstitute(GraphRewriteBuilder builder);

    protected static @Nullable Transformer reconstitute(@Nullable Transformer transformer, GraphRewriteBuilder builder) {
        return transformer == null ? null : transformer.reconstitute(builder);
    }

    /**
     * Get anything beyond the source type that identifies this node when printed.
     *
     * @return The extra details, or the empty string.
     */
    protected String details() {
        return "";
    }

    /**
     * Print this transformer and everything it runs, one node per line.
     *
     * @return The printed tree.
     */
    public String debugPrint() {
        StringBuilder sb = new StringBuilder();
        debugPrint(sb, 0, "");
        return sb.toString();
    }

    protected void debugPrint(StringBuilder sb, int indent, String label) {
        for (int i = 0; i < indent; i++) {
            sb.append("  ");
        }
        sb.append(label).append(this).append('\n');
        for (Transformer child : getChildren()) {
            child.debugPrint(sb, indent + 1, "");
        }
    }

    @Override
    public String toString() {
        String details = details();
        return mnemonic + ' ' + sourceTypeRef + (details.isEmpty() ? "" : " " + details);
    }
}
