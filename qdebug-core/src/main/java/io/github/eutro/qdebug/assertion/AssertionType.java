package io.github.eutro.qdebug.assertion;

public enum AssertionType {
    ENTANGLEMENT("assert-ent"),
    SUPERPOSITION("assert-sup"),
    STATEVECTOR_EQUALITY("assert-eq"),
    CIRCUIT_EQUALITY("assert-eq"),
    ;

    public final String keyword;

    AssertionType(String keyword) {
        this.keyword = keyword;
    }
}
