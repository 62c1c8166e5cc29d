package io.github.eutro.qdebug.passes;

import io.github.eutro.qdebug.ir.DataDependency;
import io.github.eutro.qdebug.ir.Instruction;
import io.github.eutro.qdebug.ir.InstructionKind;
import io.github.eutro.qdebug.ir.Program;
import io.github.eutro.qdebug.parsing.Operands;

import java.util.ArrayList;
import java.util.List;

/**
 * Links every instruction to the earlier instructions that last touched the variables it uses.
 * <p>
 * Each operand is reduced to its variable name, so {@code q[0]} and {@code q[1]} are both
 * {@code q}. For an instruction, earlier instructions in the same run (the top level, or a single
 * gate body, nested bodies excluded) are scanned backwards. Each operand of an earlier
 * instruction whose variable is still wanted adds a {@link DataDependency} and uses up one
 * occurrence of that variable, so repeated variables link to successively earlier instructions.
 * <p>
 * Assertions only consume. Definition headers and {@code RETURN} markers take no part.
 */
public class LinkDataDependencies implements InPlaceIRPass<Program> {
    public static final LinkDataDependencies INSTANCE = new LinkDataDependencies();

    @Override
    public void runInPlace(Program program) {
        for (Instruction insn : program.getInstructions()) {
            insn.clearDataDependencies();
            if (!consumes(insn)) continue;

            List<String> wanted = new ArrayList<>();
            for (String target : insn.getTargets()) {
                wanted.add(Operands.variableName(target));
            }
            int run = insn.getEnclosingDefinition();
            for (int i = insn.getIndex() - 1; i >= 0 && i != run && !wanted.isEmpty(); i--) {
                Instruction producer = program.get(i);
                if (producer.getEnclosingDefinition() != run || !produces(producer)) continue;
                List<String> operands = producer.getTargets();
                for (int pos = 0; pos < operands.size(); pos++) {
                    if (wanted.remove(Operands.variableName(operands.get(pos)))) {
                        insn.addDataDependency(new DataDependency(i, pos));
                    }
                }
            }
        }
    }

    private static boolean consumes(Instruction insn) {
        InstructionKind kind = insn.getKind();
        return kind != InstructionKind.FUNCTION_DEFINITION && kind != InstructionKind.RETURN;
    }

    private static boolean produces(Instruction insn) {
        return consumes(insn) && insn.getKind() != InstructionKind.ASSERTION;
    }
}
