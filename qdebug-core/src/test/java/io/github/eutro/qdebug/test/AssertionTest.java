package io.github.eutro.qdebug.test;

import io.github.eutro.qdebug.assertion.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class AssertionTest {
    private static final AssertionParser PARSER = DefaultAssertionParser.INSTANCE;

    @Test
    void recognition() {
        assertTrue(PARSER.isAssertion("  assert-ent q[0], q[1];"));
        assertFalse(PARSER.isAssertion("assertion q;"));
        assertFalse(PARSER.isAssertion("x q[0];"));
    }

    @Test
    void entanglement() {
        Assertion assertion = PARSER.parse("assert-ent q[0], q[1];", "");
        assertInstanceOf(EntanglementAssertion.class, assertion);
        assertEquals(AssertionType.ENTANGLEMENT, assertion.getType());
        assertEquals(Arrays.asList("q[0]", "q[1]"), assertion.getTargetQubits());
        assertion.validate();

        assertThrows(AssertionSyntaxException.class, () -> PARSER.parse("assert-ent q[0];", "").validate());
        assertThrows(AssertionSyntaxException.class, () -> PARSER.parse("assert-ent q[0], q[0];", "").validate());
    }

    @Test
    void superposition() {
        Assertion assertion = PARSER.parse("assert-sup q[0];", "");
        assertEquals(AssertionType.SUPERPOSITION, assertion.getType());
        assertion.validate();

        assertThrows(AssertionSyntaxException.class, () -> PARSER.parse("assert-sup;", "").validate());
    }

    @Test
    void statevectorEquality() {
        Assertion assertion = PARSER.parse("assert-eq 0.9, q[0], q[1]", " 0.5, 0.5i, -0.5, -0.5i ");
        StatevectorEqualityAssertion sv = assertInstanceOf(StatevectorEqualityAssertion.class, assertion);
        assertEquals(0.9, sv.getSimilarityThreshold());
        assertEquals(Arrays.asList("q[0]", "q[1]"), sv.getTargetQubits());
        assertEquals(new Complex(0, 0.5), sv.getAmplitudes().get(1));
        sv.validate();

        Assertion exact = PARSER.parse("assert-eq q[0]", "0.70710678, 0.70710678");
        assertEquals(EqualityAssertion.DEFAULT_SIMILARITY, ((EqualityAssertion) exact).getSimilarityThreshold());
        exact.validate();
    }

    @Test
    void badStatevectors() {
        assertThrows(AssertionSyntaxException.class, () -> PARSER.parse("assert-eq q[0], q[1]", "1, 0").validate());
        assertThrows(AssertionSyntaxException.class, () -> PARSER.parse("assert-eq q[0]", "1, 1").validate());
        assertThrows(AssertionSyntaxException.class, () -> PARSER.parse("assert-eq 1.5, q[0]", "1, 0").validate());
        assertThrows(AssertionSyntaxException.class, () -> PARSER.parse("assert-eq q[0]", "1, zero"));
        assertThrows(AssertionSyntaxException.class, () -> PARSER.parse("assert-eq q[0];", ""));
    }

    @Test
    void circuitEquality() {
        Assertion assertion = PARSER.parse("assert-eq 0.99, q[0], q[1]", " h q[0]; cx q[0], q[1]; ");
        CircuitEqualityAssertion circuit = assertInstanceOf(CircuitEqualityAssertion.class, assertion);
        assertEquals(AssertionType.CIRCUIT_EQUALITY, circuit.getType());
        assertEquals(" h q[0]; cx q[0], q[1]; ", circuit.getCircuitCode());
        circuit.validate();
    }

    @Test
    void unknownAssertions() {
        assertThrows(AssertionSyntaxException.class, () -> PARSER.parse("assert-foo q[0];", ""));
    }

    @Test
    void complexLiterals() {
        assertEquals(new Complex(0.5, 0), Complex.parse(" 0.5 "));
        assertEquals(new Complex(0, 1), Complex.parse("i"));
        assertEquals(new Complex(0, -1), Complex.parse("-i"));
        assertEquals(new Complex(0.5, -0.5), Complex.parse("0.5 - 0.5i"));
        assertEquals(new Complex(1e-3, 2), Complex.parse("1e-3+2i"));
        assertEquals(new Complex(0, 2.5e-1), Complex.parse("2.5e-1i"));
        assertThrows(AssertionSyntaxException.class, () -> Complex.parse(""));
        assertThrows(AssertionSyntaxException.class, () -> Complex.parse("1+xi"));
    }
}
