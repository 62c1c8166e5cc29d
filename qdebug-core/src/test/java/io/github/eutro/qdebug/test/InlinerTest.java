package io.github.eutro.qdebug.test;

import io.github.eutro.qdebug.ir.Instruction;
import io.github.eutro.qdebug.ir.InstructionKind;
import io.github.eutro.qdebug.ir.Program;
import io.github.eutro.qdebug.parsing.ParsingErrorLocation;
import io.github.eutro.qdebug.parsing.ParsingException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static io.github.eutro.qdebug.test.PreprocessorTest.fails;
import static io.github.eutro.qdebug.test.PreprocessorTest.preprocess;
import static org.junit.jupiter.api.Assertions.*;

public class InlinerTest {
    @Test
    void nestedDefinitions() {
        Program program = preprocess("qreg q[2];\n" +
                "gate outer a {\n" +
                "  gate inner b { h b; }\n" +
                "  inner a;\n" +
                "}\n" +
                "outer q[1];\n");
        assertEquals(8, program.size());
        for (int i = 0; i < program.size(); i++) {
            assertEquals(i, program.get(i).getIndex());
        }

        Instruction outer = program.get(1);
        assertEquals(Arrays.asList(2, 3, 4, 5), outer.getChildInstructions());
        assertEquals(7, outer.getSuccessorIndex());
        assertEquals(Collections.singletonList("a"), outer.getTargets());

        Instruction inner = program.get(2);
        assertTrue(inner.isFunctionDefinition());
        assertEquals(Collections.singletonList(3), inner.getChildInstructions());
        assertEquals(5, inner.getSuccessorIndex());

        int[] enclosing = {Instruction.TOP_LEVEL, Instruction.TOP_LEVEL, 1, 2, 2, 1, 1, Instruction.TOP_LEVEL};
        for (int i = 0; i < enclosing.length; i++) {
            assertEquals(enclosing[i], program.get(i).getEnclosingDefinition(), "instruction " + i);
        }

        assertTrue(program.get(4).isReturn());
        assertEquals(0, program.get(4).getSuccessorIndex());
        assertTrue(program.get(6).isReturn());
        assertEquals(0, program.get(6).getSuccessorIndex());

        Instruction innerCall = program.get(5);
        assertEquals("inner", innerCall.getCalledFunction());
        assertEquals(3, innerCall.getSuccessorIndex());
        assertEquals(Collections.singletonMap("b", "a"), innerCall.getCallSubstitution());

        Instruction outerCall = program.get(7);
        assertEquals(2, outerCall.getSuccessorIndex());
        assertEquals(Collections.singletonMap("a", "q[1]"), outerCall.getCallSubstitution());
    }

    @Test
    void returnsCarryTheParameters() {
        Program program = preprocess("qreg q[2];\ngate swap2 a, b { cx a, b; cx b, a; cx a, b; }\nswap2 q[0], q[1];");
        Instruction ret = program.get(5);
        assertEquals(InstructionKind.RETURN, ret.getKind());
        assertEquals("RETURN", ret.getCode());
        assertEquals(Arrays.asList("a", "b"), ret.getTargets());

        Map<String, String> substitution = new HashMap<>();
        substitution.put("a", "q[0]");
        substitution.put("b", "q[1]");
        assertEquals(substitution, program.get(6).getCallSubstitution());
        assertEquals(Arrays.asList("a", "b"), program.getFunctions().get("swap2").parameters);
    }

    @Test
    void emptyBodiesReturnImmediately() {
        Program program = preprocess("qreg q[1];\ngate nop a { }\nnop q[0];");
        assertTrue(program.get(1).getChildInstructions().isEmpty());
        assertEquals(3, program.get(1).getSuccessorIndex());
        assertTrue(program.get(2).isReturn());
        assertEquals(2, program.get(3).getSuccessorIndex());
    }

    @Test
    void forwardReferences() {
        Program program = preprocess("qreg q[1];\nfoo q[0];\ngate foo a { x a; }\nfoo q[0];");
        assertTrue(program.get(1).isFunctionCall());
        assertEquals(3, program.get(1).getSuccessorIndex());
        assertEquals(3, program.get(5).getSuccessorIndex());
        assertEquals(2, program.getDefinitionHeader("foo").getIndex());
    }

    @Test
    void callsWithClassicalParameters() {
        Program program = preprocess("qreg q[1];\ngate rot(theta) a { rx(theta) a; }\nrot(0.5) q[0];");
        Instruction call = program.get(4);
        assertEquals("rot", call.getCalledFunction());
        assertEquals(Collections.singletonMap("a", "q[0]"), call.getCallSubstitution());
        assertEquals(Collections.singletonList("a"), program.get(2).getTargets());
    }

    @Test
    void builtinGatesAreNotCalls() {
        Program program = preprocess("qreg q[1];\ngate foo a { x a; }\nfoobar q[0];\nx q[0];");
        assertFalse(program.get(4).isFunctionCall());
        assertFalse(program.get(5).isFunctionCall());
        assertEquals(5, program.get(4).getSuccessorIndex());
    }

    @Test
    void parametersShadowRegisters() {
        Program program = assertDoesNotThrow(() -> preprocess("qreg q[1];\ngate foo q { x q[3]; }\nfoo q[0];"));
        assertEquals(Collections.singletonList("q[3]"), program.get(2).getTargets());
        assertEquals(1, program.get(2).getEnclosingDefinition());

        ParsingException e = fails("qreg q[1];\nx q[3];");
        assertEquals(ParsingException.Kind.INVALID_TARGET_QUBIT, e.getKind());
    }

    @Test
    void callsResolveToTheNearestDefinition() {
        Program program = preprocess("qreg q[1];\n" +
                "gate ga a { gate h2 x { x x; } h2 a; }\n" +
                "gate gb b { gate h2 y { y y; } h2 b; }\n" +
                "gb q[0];\n");
        assertEquals(14, program.size());

        Instruction first = program.get(5);
        assertEquals("h2", first.getCalledFunction());
        assertEquals(3, first.getSuccessorIndex());
        assertEquals(Collections.singletonMap("x", "a"), first.getCallSubstitution());

        Instruction second = program.get(11);
        assertEquals("h2", second.getCalledFunction());
        assertEquals(9, second.getSuccessorIndex());
        assertEquals(Collections.singletonMap("y", "b"), second.getCallSubstitution());

        assertEquals(8, program.resolveDefinition("h2", 7).getIndex());
        assertEquals(2, program.getDefinitionHeader("h2").getIndex());
        assertEquals(8, program.get(13).getSuccessorIndex());
    }

    @Test
    void innerDefinitionsAreVisibleToNestedBodies() {
        Program program = preprocess("qreg q[1];\n" +
                "gate h2 z { z z; }\n" +
                "gate outer a { gate h2 x { x x; } gate mid m { h2 m; } mid a; }\n" +
                "h2 q[0];\n");
        Instruction inMid = program.get(9);
        assertEquals("h2", inMid.getCalledFunction());
        assertEquals(6, inMid.getSuccessorIndex());

        Instruction topLevel = program.get(13);
        assertEquals("h2", topLevel.getCalledFunction());
        assertEquals(2, topLevel.getSuccessorIndex());
    }

    @Test
    void missingBody() {
        ParsingException e = fails("qreg q[2];\n  gate foo a;\nfoo q[0];");
        assertEquals(ParsingException.Kind.MISSING_BODY_BLOCK, e.getKind());
        assertEquals(new ParsingErrorLocation(2, 3, "Gate definitions require a body block."), e.getLocation());
    }

    @Test
    void arityMismatch() {
        ParsingException tooMany = fails("qreg q[2];\ngate foo a { x a; }\n  foo q[0], q[1];");
        assertEquals(ParsingException.Kind.ARITY_MISMATCH, tooMany.getKind());
        assertEquals(3, tooMany.getLocation().line);
        assertEquals(3, tooMany.getLocation().column);

        ParsingException tooFew = fails("qreg q[2];\ngate foo a, b { cx a, b; }\nfoo q[0];");
        assertEquals(ParsingException.Kind.ARITY_MISMATCH, tooFew.getKind());
    }

    @Test
    void errorsInBodiesAreLocatedInTheWholeProgram() {
        ParsingException e = fails("qreg q[2];\ngate foo a {\n  x a;\n  x q[7];\n}\n");
        assertEquals(ParsingException.Kind.INVALID_TARGET_QUBIT, e.getKind());
        assertEquals(new ParsingErrorLocation(4, 5, "Invalid target qubit q[7]."), e.getLocation());

        ParsingException nested = fails("qreg q[2];\ngate foo a {\n  gate bar b {\n    creg c[x];\n  }\n}\n");
        assertEquals(ParsingException.Kind.INVALID_REGISTER_DECLARATION, nested.getKind());
        assertEquals(new ParsingErrorLocation(4, 5, "Invalid register declaration creg c[x];."), nested.getLocation());
    }
}
