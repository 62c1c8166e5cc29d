package io.github.eutro.qdebug.test;

import io.github.eutro.qdebug.ir.FunctionDefinition;
import io.github.eutro.qdebug.parsing.Operands;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class OperandsTest {
    @Test
    void gateOperands() {
        assertEquals(Arrays.asList("q[0]", "q[1]"), Operands.parse("cx q[0], q[1];"));
        assertEquals(Arrays.asList("q[0]", "q[1]"), Operands.parse("cx q[0] ,\n q[1] ;"));
        assertEquals(Collections.singletonList("q"), Operands.parse("h q;"));
        assertEquals(Collections.emptyList(), Operands.parse("barrier;"));
    }

    @Test
    void parameterListsAreSkipped() {
        assertEquals(Collections.singletonList("q[0]"), Operands.parse("rx(0.5) q[0];"));
        assertEquals(Collections.singletonList("q[0]"), Operands.parse("u3(0.1, 0.2, 0.3) q[0];"));
        assertEquals(Arrays.asList("q[0]", "q[1]"), Operands.parse("cu1(pi / 2) q[0],q[1];"));
    }

    @Test
    void emptyOperandsAreKept() {
        assertEquals(Arrays.asList("q[0]", ""), Operands.parse("x q[0],;"));
    }

    @Test
    void measurementsOnlyTargetQubits() {
        assertEquals(Collections.singletonList("q[0]"), Operands.parse("measure q[0] -> c[0];"));
        assertEquals(Collections.singletonList("q"), Operands.parse("measure q -> c;"));
    }

    @Test
    void classicControlled() {
        assertEquals(Arrays.asList("x q[0];", "y q[1];"), Operands.parseClassicControlled("if (c == 1) { x q[0]; ; y q[1]; }"));
        assertEquals(Arrays.asList("q[0]", "q[1]"), Operands.parse("if (c == 1) { x q[0]; y q[1]; }"));
        assertEquals(Collections.singletonList("q[1]"), Operands.parse("if ((c + 1) == 2) x q[1];"));
        assertEquals(Collections.singletonList("x q[1];"), Operands.parseClassicControlled("if ((c + 1) == 2) x q[1];"));
    }

    @Test
    void functionDefinitions() {
        FunctionDefinition foo = Operands.parseFunctionDefinition("gate foo a, b");
        assertEquals("foo", foo.name);
        assertEquals(Arrays.asList("a", "b"), foo.parameters);

        FunctionDefinition rz = Operands.parseFunctionDefinition("gate rz2(theta, phi) x,y");
        assertEquals("rz2", rz.name);
        assertEquals(Arrays.asList("x", "y"), rz.parameters);

        FunctionDefinition none = Operands.parseFunctionDefinition("gate nop");
        assertEquals("nop", none.name);
        assertTrue(none.parameters.isEmpty());

        assertEquals(Arrays.asList("a", "b"), Operands.parse("gate foo a ,b { x a; }"));
    }

    @Test
    void functionNames() {
        assertEquals(
                Arrays.asList("foo", "bar", "baz"),
                Operands.sweepFunctionNames("gate foo a { gate bar b { x b; } bar a; }\ngate baz c { }")
        );
        assertTrue(Operands.sweepFunctionNames("qreg q[2]; x q[0];").isEmpty());
    }

    @Test
    void identifiers() {
        assertEquals("foo", Operands.leadingIdentifier("  foo q[0];"));
        assertEquals("foo", Operands.leadingIdentifier("foo(0.5) q[0];"));
        assertEquals("barrier", Operands.leadingIdentifier("barrier;"));
        assertEquals("q", Operands.variableName("q[1]"));
        assertEquals("a", Operands.variableName("a"));
    }
}
