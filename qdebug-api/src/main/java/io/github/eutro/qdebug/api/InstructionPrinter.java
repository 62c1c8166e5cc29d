package io.github.eutro.qdebug.api;

import io.github.eutro.qdebug.ir.DataDependency;
import io.github.eutro.qdebug.ir.FunctionDefinition;
import io.github.eutro.qdebug.ir.Instruction;
import io.github.eutro.qdebug.ir.Program;

import java.util.Map;

/**
 * Renders a {@link Program} as a human-readable listing, one instruction per line.
 * <p>
 * Each line shows the index, the kind, the code, and the non-default links:
 * <pre>
 *   3 PLAIN_GATE    foo q[0];  -&gt; 1  {a=q[0]}  deps (0, 0)
 * </pre>
 * Gate bodies are indented by their nesting depth.
 */
public class InstructionPrinter {
    private final StringBuilder sb = new StringBuilder();

    public static String print(Program program) {
        InstructionPrinter printer = new InstructionPrinter();
        printer.printHeader(program);
        for (Instruction insn : program.getInstructions()) {
            printer.printInstruction(program, insn);
        }
        return printer.sb.toString();
    }

    private void printHeader(Program program) {
        for (Map.Entry<String, Integer> register : program.getRegisters().entrySet()) {
            sb.append("; register ").append(register.getKey()).append('[').append(register.getValue()).append("]\n");
        }
        for (FunctionDefinition function : program.getFunctions().values()) {
            sb.append("; gate ").append(function).append('\n');
        }
    }

    private void printInstruction(Program program, Instruction insn) {
        sb.append(String.format("%4d ", insn.getIndex()));
        for (int d = depth(program, insn); d > 0; d--) sb.append("  ");
        sb.append(String.format("%-19s ", insn.getKind()));
        sb.append(insn.getCode().replace('\n', ' '));
        if (insn.getSuccessorIndex() != insn.getIndex() + 1) {
            sb.append("  -> ").append(insn.getSuccessorIndex());
        }
        if (!insn.getCallSubstitution().isEmpty()) {
            sb.append("  ").append(insn.getCallSubstitution());
        }
        if (!insn.getDataDependencies().isEmpty()) {
            sb.append("  deps");
            for (DataDependency dep : insn.getDataDependencies()) {
                sb.append(' ').append(dep);
            }
        }
        sb.append('\n');
    }

    private static int depth(Program program, Instruction insn) {
        int depth = 0;
        int def = insn.getEnclosingDefinition();
        while (def != Instruction.TOP_LEVEL) {
            depth++;
            def = program.get(def).getEnclosingDefinition();
        }
        return depth;
    }
}
