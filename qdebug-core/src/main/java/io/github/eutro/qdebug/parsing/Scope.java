package io.github.eutro.qdebug.parsing;

import io.github.eutro.qdebug.ir.Instruction;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * The names visible while preprocessing one level of a program: the top level, or the body
 * of a single gate.
 * <p>
 * Registers are global, so every scope of a preprocessing call shares one register table.
 * The known gate names and the shadowed registers belong to the scope itself.
 */
public final class Scope {
    private final Map<String, Integer> registers;
    private final List<String> functionNames;
    private final Set<String> shadowedRegisters;
    private final int enclosingDefinition;

    private Scope(Map<String, Integer> registers, List<String> functionNames, Set<String> shadowedRegisters, int enclosingDefinition) {
        this.registers = registers;
        this.functionNames = functionNames;
        this.shadowedRegisters = shadowedRegisters;
        this.enclosingDefinition = enclosingDefinition;
    }

    /**
     * Create the scope of the top level of a program.
     *
     * @return The scope.
     */
    @NotNull
    public static Scope root() {
        return new Scope(new LinkedHashMap<>(), new ArrayList<>(), Collections.emptySet(), Instruction.TOP_LEVEL);
    }

    /**
     * Create the scope of a gate body nested in this one.
     *
     * @param header     The index of the definition header.
     * @param parameters The formal parameters of the gate, which shadow registers of the same name.
     * @return The scope.
     */
    @NotNull
    public Scope enterFunction(int header, List<String> parameters) {
        return new Scope(registers, new ArrayList<>(functionNames), new LinkedHashSet<>(parameters), header);
    }

    /**
     * Make gate names known in this scope.
     *
     * @param names The names.
     */
    public void addFunctionNames(Collection<String> names) {
        for (String name : names) {
            if (!functionNames.contains(name)) functionNames.add(name);
        }
    }

    public boolean isFunction(String name) {
        return functionNames.contains(name);
    }

    /**
     * Declare a register. A register that is already declared keeps its first size.
     *
     * @param name The name.
     * @param size The size.
     */
    public void declareRegister(String name, int size) {
        registers.putIfAbsent(name, size);
    }

    /**
     * Get the registers declared so far, in the whole program.
     *
     * @return The registers and their sizes.
     */
    public Map<String, Integer> getRegisters() {
        return registers;
    }

    public boolean isShadowed(String name) {
        return shadowedRegisters.contains(name);
    }

    /**
     * Get the index of the header of the gate this scope is the body of, or
     * {@link Instruction#TOP_LEVEL} at the top level.
     *
     * @return The index.
     */
    public int getEnclosingDefinition() {
        return enclosingDefinition;
    }
}
