package io.github.eutro.qdebug.assertion;

import java.util.List;

/**
 * Asserts that the target qubits are in a superposition.
 */
public class SuperpositionAssertion extends Assertion {
    public SuperpositionAssertion(List<String> targetQubits) {
        super(AssertionType.SUPERPOSITION, targetQubits);
    }
}
