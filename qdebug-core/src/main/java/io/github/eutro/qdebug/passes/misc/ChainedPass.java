package io.github.eutro.qdebug.passes.misc;

import io.github.eutro.qdebug.passes.IRPass;

/**
 * A pass which composes two others, executing the first, and giving its result to the second.
 * <p>
 * An exception thrown by either pass is rethrown unchanged, with a suppressed exception
 * naming the pass that failed. Nested chains each add their own.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;

    /**
     * Construct a chained pass.
     *
     * @param firstPass The first pass to run.
     * @param nextPass  The next pass to run.
     */
    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    @Override
    public C run(A a) {
        B b;
        try {
            b = firstPass.run(a);
        } catch (RuntimeException e) {
            throw failedIn(e, "first", firstPass);
        }
        try {
            return nextPass.run(b);
        } catch (RuntimeException e) {
            throw failedIn(e, "second", nextPass);
        }
    }

    private static RuntimeException failedIn(RuntimeException e, String position, IRPass<?, ?> pass) {
        e.addSuppressed(new RuntimeException("in " + position + " pass of chain: " + pass.getClass().getSimpleName()));
        return e;
    }
}
