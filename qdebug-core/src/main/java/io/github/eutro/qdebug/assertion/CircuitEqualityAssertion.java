package io.github.eutro.qdebug.assertion;

import io.github.eutro.qdebug.util.Strings;

import java.util.List;

/**
 * Compares the target qubits against the state prepared by a small circuit.
 */
public class CircuitEqualityAssertion extends EqualityAssertion {
    private final String circuitCode;

    public CircuitEqualityAssertion(List<String> targetQubits, double similarityThreshold, String circuitCode) {
        super(AssertionType.CIRCUIT_EQUALITY, targetQubits, similarityThreshold);
        this.circuitCode = circuitCode;
    }

    public String getCircuitCode() {
        return circuitCode;
    }

    @Override
    public void validate() {
        super.validate();
        if (Strings.trim(circuitCode).isEmpty()) {
            throw new AssertionSyntaxException("Circuit equality assertion requires a circuit.");
        }
    }
}
