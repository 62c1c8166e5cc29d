package io.github.eutro.qdebug.assertion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compares the target qubits against an explicit list of amplitudes.
 */
public class StatevectorEqualityAssertion extends EqualityAssertion {
    static final double NORM_EPSILON = 1e-5;

    private final List<Complex> amplitudes;

    public StatevectorEqualityAssertion(List<String> targetQubits, double similarityThreshold, List<Complex> amplitudes) {
        super(AssertionType.STATEVECTOR_EQUALITY, targetQubits, similarityThreshold);
        this.amplitudes = Collections.unmodifiableList(new ArrayList<>(amplitudes));
    }

    public List<Complex> getAmplitudes() {
        return amplitudes;
    }

    @Override
    public void validate() {
        super.validate();
        int qubits = getTargetQubits().size();
        if (qubits >= 31 || amplitudes.size() != 1 << qubits) {
            throw new AssertionSyntaxException("Statevector over " + qubits + " qubits must have "
                    + (qubits >= 31 ? "too many" : String.valueOf(1 << qubits))
                    + " amplitudes, got " + amplitudes.size() + ".");
        }
        double norm = 0;
        for (Complex amplitude : amplitudes) {
            norm += amplitude.normSquared();
        }
        if (Math.abs(norm - 1) > NORM_EPSILON) {
            throw new AssertionSyntaxException("Statevector is not normalised.");
        }
    }
}
