package io.github.eutro.qdebug.passes;

import io.github.eutro.qdebug.ir.Program;

/**
 * Common compositions of passes.
 */
public class Passes {
    /**
     * The passes run once over a complete program: call resolution, then data dependency linking.
     */
    public static final IRPass<Program, Program> LINK = ResolveCalls.INSTANCE
            .then(LinkDataDependencies.INSTANCE);
}
