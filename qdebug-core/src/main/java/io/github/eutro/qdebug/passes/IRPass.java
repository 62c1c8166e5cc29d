package io.github.eutro.qdebug.passes;

import io.github.eutro.qdebug.passes.misc.ChainedPass;

/**
 * A pass over some IR, producing some (possibly the same) IR.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    B run(A a);

    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
