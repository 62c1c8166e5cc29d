package io.github.eutro.qdebug.assertion;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A parsed assertion over a list of target qubits.
 */
public abstract class Assertion {
    private final AssertionType type;
    private List<String> targetQubits;

    protected Assertion(AssertionType type, List<String> targetQubits) {
        this.type = type;
        this.targetQubits = new ArrayList<>(targetQubits);
    }

    @NotNull
    public AssertionType getType() {
        return type;
    }

    @NotNull
    public List<String> getTargetQubits() {
        return Collections.unmodifiableList(targetQubits);
    }

    /**
     * Replace the target qubits, e.g. after unfolding whole registers into their qubits.
     *
     * @param targetQubits The new targets.
     */
    public void setTargetQubits(List<String> targetQubits) {
        this.targetQubits = new ArrayList<>(targetQubits);
    }

    /**
     * Check that this assertion is well-formed.
     *
     * @throws AssertionSyntaxException If it is not.
     */
    public void validate() {
        if (targetQubits.isEmpty()) {
            throw new AssertionSyntaxException("Assertion " + type.keyword + " requires at least one target.");
        }
        Set<String> seen = new HashSet<>();
        for (String target : targetQubits) {
            if (!seen.add(target)) {
                throw new AssertionSyntaxException("Assertion " + type.keyword + " targets " + target + " twice.");
            }
        }
    }

    @Override
    public String toString() {
        return type.keyword + " " + String.join(", ", targetQubits);
    }
}
