package io.github.eutro.qdebug.ir;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A preprocessed program: its flat instruction list, with the registers and gates it declares.
 * <p>
 * The program is the sole owner of its instructions; gate bodies are part of the same list.
 */
public final class Program {
    private final String source;
    private final String processedCode;
    private final List<Instruction> instructions;
    private final Map<String, Integer> registers;
    private final Map<String, FunctionDefinition> functions;
    private final Map<String, Integer> definitionHeaders;
    private final Map<Integer, Map<String, Integer>> localDefinitions;

    public Program(
            String source,
            String processedCode,
            List<Instruction> instructions,
            Map<String, Integer> registers,
            Map<String, FunctionDefinition> functions,
            Map<String, Integer> definitionHeaders,
            Map<Integer, Map<String, Integer>> localDefinitions
    ) {
        this.source = source;
        this.processedCode = processedCode;
        this.instructions = Collections.unmodifiableList(instructions);
        this.registers = Collections.unmodifiableMap(registers);
        this.functions = Collections.unmodifiableMap(functions);
        this.definitionHeaders = Collections.unmodifiableMap(definitionHeaders);
        this.localDefinitions = Collections.unmodifiableMap(localDefinitions);
    }

    /**
     * Get the program text as it was given.
     *
     * @return The source.
     */
    @NotNull
    public String getSource() {
        return source;
    }

    /**
     * Get the program text with comments blanked out.
     *
     * @return The processed code.
     */
    @NotNull
    public String getProcessedCode() {
        return processedCode;
    }

    @NotNull
    public List<Instruction> getInstructions() {
        return instructions;
    }

    @NotNull
    public Instruction get(int index) {
        return instructions.get(index);
    }

    public int size() {
        return instructions.size();
    }

    /**
     * Get the declared registers and their sizes, in declaration order.
     *
     * @return The registers.
     */
    @NotNull
    public Map<String, Integer> getRegisters() {
        return registers;
    }

    /**
     * Get the defined gates, in definition order.
     *
     * @return The functions.
     */
    @NotNull
    public Map<String, FunctionDefinition> getFunctions() {
        return functions;
    }

    /**
     * Find the header of the first definition of a gate, wherever it is.
     *
     * @param name The gate name.
     * @return The header, or null if there is no such gate.
     */
    @Nullable
    public Instruction getDefinitionHeader(String name) {
        Integer header = definitionHeaders.get(name);
        return header == null ? null : instructions.get(header);
    }

    /**
     * Find the definition a gate name refers to from inside a run of instructions.
     * <p>
     * Definitions written in the run itself are preferred, then those of each enclosing run
     * outwards, then the first definition anywhere in the program.
     *
     * @param name                The gate name.
     * @param enclosingDefinition The header of the run the name is used in, or
     *                            {@link Instruction#TOP_LEVEL}.
     * @return The header, or null if there is no such gate.
     */
    @Nullable
    public Instruction resolveDefinition(String name, int enclosingDefinition) {
        int run = enclosingDefinition;
        while (true) {
            Map<String, Integer> local = localDefinitions.get(run);
            Integer header = local == null ? null : local.get(name);
            if (header != null) return instructions.get(header);
            if (run == Instruction.TOP_LEVEL) break;
            run = instructions.get(run).getEnclosingDefinition();
        }
        return getDefinitionHeader(name);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Instruction insn : instructions) {
            sb.append(insn).append('\n');
        }
        return sb.toString();
    }
}
