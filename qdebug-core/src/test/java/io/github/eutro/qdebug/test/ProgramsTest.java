package io.github.eutro.qdebug.test;

import io.github.eutro.qdebug.ir.Instruction;
import io.github.eutro.qdebug.ir.Program;
import io.github.eutro.qdebug.parsing.Preprocessor;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class ProgramsTest {
    private static final String COUNT_PREFIX = "// instructions: ";

    @TestFactory
    Stream<DynamicTest> programs() {
        return Utils.PROGRAMS.stream().map(name -> DynamicTest.dynamicTest(name, () -> {
            String code = Utils.getProgram(name);
            Program program = new Preprocessor().setVerify(true).preprocess(code);

            assertTrue(code.startsWith(COUNT_PREFIX), name);
            int expected = Integer.parseInt(code.substring(COUNT_PREFIX.length(), code.indexOf('\n')).trim());
            assertEquals(expected, program.size());

            for (Instruction insn : program.getInstructions()) {
                assertTrue(insn.getSourceStart() <= insn.getSourceEnd(), insn.toString());
                char last = code.charAt(insn.getSourceEnd());
                assertTrue(last == ';' || last == '}', insn.toString());
                if (insn.isReturn()) {
                    assertEquals(Instruction.POP_CALL_STACK, insn.getSuccessorIndex());
                }
                if (insn.isFunctionCall()) {
                    assertFalse(insn.getCallSubstitution().isEmpty(), insn.toString());
                }
            }
        }));
    }
}
