package io.github.eutro.qdebug.assertion;

import java.util.List;

/**
 * Asserts that every pair of the target qubits is entangled.
 */
public class EntanglementAssertion extends Assertion {
    public EntanglementAssertion(List<String> targetQubits) {
        super(AssertionType.ENTANGLEMENT, targetQubits);
    }

    @Override
    public void validate() {
        super.validate();
        if (getTargetQubits().size() < 2) {
            throw new AssertionSyntaxException("Entanglement assertion requires at least two targets.");
        }
    }
}
