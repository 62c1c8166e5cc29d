package io.github.eutro.qdebug.passes;

/**
 * An IR pass which modifies its input, and returns it.
 *
 * @param <T> The type of the IR this pass operates on.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Run the pass.
     *
     * @param t The IR to run this pass on.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }
}
