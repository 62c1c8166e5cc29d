package io.github.eutro.qdebug.ir;

import io.github.eutro.qdebug.assertion.AssertionParser;
import io.github.eutro.qdebug.util.Strings;
import org.jetbrains.annotations.NotNull;

/**
 * The syntactic kind of an instruction, determined once from its text.
 */
public enum InstructionKind {
    /**
     * {@code gate name params { ... }}, the header of a gate definition.
     */
    FUNCTION_DEFINITION,
    /**
     * {@code qreg name[size];} or {@code creg name[size];}.
     */
    VARIABLE_DECLARATION,
    /**
     * {@code if (cond) gate;} or {@code if (cond) { gates }}.
     */
    CLASSIC_CONTROLLED,
    /**
     * An assertion, as recognised by the {@link AssertionParser}.
     */
    ASSERTION,
    /**
     * {@code measure q -> c;}.
     */
    MEASUREMENT,
    RESET,
    BARRIER,
    /**
     * Any other gate application, including calls of user-defined gates.
     */
    PLAIN_GATE,
    /**
     * The synthetic marker at the end of every inlined gate body.
     */
    RETURN,
    ;

    public static boolean isFunctionDefinition(String line) {
        return Strings.trim(line).startsWith("gate ");
    }

    public static boolean isVariableDeclaration(String line) {
        String trimmed = Strings.trim(line);
        return trimmed.startsWith("creg ") || trimmed.startsWith("qreg ");
    }

    public static boolean isReset(String line) {
        return Strings.trim(line).startsWith("reset ");
    }

    public static boolean isBarrier(String line) {
        String trimmed = Strings.trim(line);
        return trimmed.startsWith("barrier ") || trimmed.startsWith("barrier;");
    }

    public static boolean isClassicControlled(String line) {
        String trimmed = Strings.trim(line);
        if (!trimmed.startsWith("if") || trimmed.length() < 3) return false;
        char next = trimmed.charAt(2);
        if (next != '(' && !Strings.isBlank(next)) return false;
        int open = trimmed.indexOf('(');
        return open != -1 && trimmed.indexOf(')', open) != -1;
    }

    public static boolean isMeasurement(String line) {
        return line.contains("->");
    }

    /**
     * Classify an instruction.
     * <p>
     * Well-formed instructions only ever match one kind; for others, the first matching kind
     * in declaration order wins.
     *
     * @param line       The instruction text.
     * @param assertions The parser that decides what is an assertion.
     * @return The kind.
     */
    @NotNull
    public static InstructionKind classify(String line, AssertionParser assertions) {
        if (isFunctionDefinition(line)) return FUNCTION_DEFINITION;
        if (isVariableDeclaration(line)) return VARIABLE_DECLARATION;
        if (isClassicControlled(line)) return CLASSIC_CONTROLLED;
        if (assertions.isAssertion(line)) return ASSERTION;
        if (isMeasurement(line)) return MEASUREMENT;
        if (isReset(line)) return RESET;
        if (isBarrier(line)) return BARRIER;
        return PLAIN_GATE;
    }
}
