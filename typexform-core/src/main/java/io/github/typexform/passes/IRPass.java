package io.github.typexform.passes;

import io.github.typexform.passes.misc.ChainedPass;

/**
 * A pass over some IR, producing some (possibly the same) IR.
 *
 * @param <A> The type of the input.
 * @param <B> The type of the output.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input.
     * @return The output.
     */
    B run(A a);

    /**
     * Whether this pass modifies its input and returns it, rather than building something new.
     *
     * @return Whether the pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another, which is given the result of this one.
     *
     * @param next The pass to run after this.
     * @param <C>  The output type of the next pass.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
