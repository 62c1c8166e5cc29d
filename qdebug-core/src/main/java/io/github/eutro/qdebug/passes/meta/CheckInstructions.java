package io.github.eutro.qdebug.passes.meta;

import io.github.eutro.qdebug.ir.Instruction;
import io.github.eutro.qdebug.ir.InstructionKind;
import io.github.eutro.qdebug.ir.Program;
import io.github.eutro.qdebug.passes.InPlaceIRPass;

import java.util.List;

/**
 * A pass which checks the structure of a linked program, throwing
 * {@link IllegalStateException} on the first violation found.
 * <p>
 * It checks that:
 * <ul>
 *     <li>instructions are numbered contiguously from zero;</li>
 *     <li>source ranges lie within the program text;</li>
 *     <li>every {@code RETURN} returns to the caller;</li>
 *     <li>every call enters the body of the gate it calls;</li>
 *     <li>every other instruction falls through, except definition headers, which skip their body;</li>
 *     <li>every definition header lists exactly the instructions of its body.</li>
 * </ul>
 */
public class CheckInstructions implements InPlaceIRPass<Program> {
    /**
     * A singleton instance of this class.
     */
    public static final CheckInstructions INSTANCE = new CheckInstructions();

    @Override
    public void runInPlace(Program program) {
        int sourceLength = program.getSource().length();
        for (int i = 0; i < program.size(); i++) {
            Instruction insn = program.get(i);
            if (insn.getIndex() != i) {
                throw fail(insn, "is at position " + i);
            }
            if (insn.getSourceStart() < 0
                    || insn.getSourceStart() > insn.getSourceEnd()
                    || insn.getSourceEnd() > sourceLength) {
                throw fail(insn, "has bad source range " + insn.getSourceStart() + ".." + insn.getSourceEnd());
            }
            int expected;
            if (insn.isReturn()) {
                expected = Instruction.POP_CALL_STACK;
            } else if (insn.isFunctionDefinition()) {
                checkDefinition(program, insn);
                expected = insn.getIndex() + insn.getChildInstructions().size() + 2;
            } else if (insn.isFunctionCall() && resolve(program, insn) != null) {
                expected = resolve(program, insn).getIndex() + 1;
            } else {
                expected = insn.getIndex() + 1;
            }
            if (insn.getSuccessorIndex() != expected) {
                throw fail(insn, "has successor " + insn.getSuccessorIndex() + ", expected " + expected);
            }
        }
    }

    private static void checkDefinition(Program program, Instruction header) {
        List<Integer> children = header.getChildInstructions();
        int last = header.getIndex() + children.size() + 1;
        if (last >= program.size() || program.get(last).getKind() != InstructionKind.RETURN) {
            throw fail(header, "is not closed by a RETURN at " + last);
        }
        int direct = 0;
        for (int i = header.getIndex() + 1; i <= last; i++) {
            Instruction child = program.get(i);
            if (child.getEnclosingDefinition() == header.getIndex()) {
                direct++;
            } else if (child.getEnclosingDefinition() < header.getIndex()) {
                throw fail(child, "is in the body of " + header.getIndex() + " but not tagged as such");
            }
        }
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) != header.getIndex() + 1 + i) {
                throw fail(header, "has non-contiguous children " + children);
            }
        }
        if (direct == 0) {
            throw fail(header, "has no instructions tagged as its body");
        }
    }

    private static Instruction resolve(Program program, Instruction call) {
        return program.resolveDefinition(call.getCalledFunction(), call.getEnclosingDefinition());
    }

    private static IllegalStateException fail(Instruction insn, String message) {
        return new IllegalStateException("instruction " + insn + " " + message);
    }
}
