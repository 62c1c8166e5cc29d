package io.github.eutro.qdebug.assertion;

import java.util.List;

/**
 * Asserts that the state of the target qubits is similar to some expected state.
 */
public abstract class EqualityAssertion extends Assertion {
    public static final double DEFAULT_SIMILARITY = 1.0;

    private final double similarityThreshold;

    protected EqualityAssertion(AssertionType type, List<String> targetQubits, double similarityThreshold) {
        super(type, targetQubits);
        this.similarityThreshold = similarityThreshold;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    @Override
    public void validate() {
        super.validate();
        if (!(similarityThreshold >= 0 && similarityThreshold <= 1)) {
            throw new AssertionSyntaxException("Similarity threshold must be between 0 and 1, got " + similarityThreshold + ".");
        }
    }
}
