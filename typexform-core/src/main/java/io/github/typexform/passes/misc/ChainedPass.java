package io.github.typexform.passes.misc;

import io.github.typexform.passes.IRPass;

/**
 * A pass which composes two others, executing the first, and giving its result to the second.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    @Override
    public boolean isInPlace() {
        return firstPass.isInPlace() && nextPass.isInPlace();
    }

    @Override
    public C run(A a) {
        B b;
        try {
            b = firstPass.run(a);
        } catch (RuntimeException e) {
            e.addSuppressed(new RuntimeException("running " + firstPass + " in chain"));
            throw e;
        }
        try {
            return nextPass.run(b);
        } catch (RuntimeException e) {
            e.addSuppressed(new RuntimeException("running " + nextPass + " in chain"));
            throw e;
        }
    }

    @Override
    public String toString() {
        return firstPass + " -> " + nextPass;
    }
}
