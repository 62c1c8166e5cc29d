package io.github.eutro.qdebug.parsing;

import io.github.eutro.qdebug.ir.FunctionDefinition;
import io.github.eutro.qdebug.ir.InstructionKind;
import io.github.eutro.qdebug.util.Strings;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts operands and other structure from the text of single instructions.
 */
public class Operands {
    private Operands() {
    }

    /**
     * Extract the operands of an instruction.
     * <ul>
     *     <li>For a gate definition, these are its formal parameters.</li>
     *     <li>For a classically controlled gate, these are the operands of every guarded
     *     operation, concatenated.</li>
     *     <li>For a measurement, these are the quantum operands only, those before {@code ->}.</li>
     *     <li>Otherwise, the leading opcode (with any parenthesised parameter list) is skipped,
     *     and the rest is split on commas, ignoring whitespace.</li>
     * </ul>
     *
     * @param code The instruction text.
     * @return The operands.
     */
    @Contract(pure = true)
    @NotNull
    public static List<String> parse(String code) {
        if (InstructionKind.isFunctionDefinition(code)) {
            return parseFunctionDefinition(code).parameters;
        }
        if (InstructionKind.isClassicControlled(code)) {
            List<String> operands = new ArrayList<>();
            for (String operation : parseClassicControlled(code)) {
                operands.addAll(parse(operation));
            }
            return operands;
        }
        if (InstructionKind.isMeasurement(code)) {
            return parse(code.substring(0, code.indexOf("->")));
        }
        return parseDefault(code);
    }

    private static List<String> parseDefault(String code) {
        List<String> parts = Strings.tokens(code.replace(';', ' '));
        int index = 0;
        int openBrackets = 0;
        for (String part : parts) {
            index++;
            openBrackets += Strings.count(part, '(') - Strings.count(part, ')');
            if (openBrackets == 0) break;
        }

        StringBuilder rest = new StringBuilder();
        for (int i = index; i < parts.size(); i++) {
            rest.append(parts.get(i));
        }
        List<String> operands = Strings.split(rest.toString(), ',');
        if (operands.size() == 1 && operands.get(0).isEmpty()) {
            return new ArrayList<>();
        }
        return operands;
    }

    /**
     * Parse the signature of a gate definition, {@code gate name(classical, ...) a, b, ...}.
     * <p>
     * Any parenthesised classical parameter list is skipped; the parameters of the result
     * are the qubit parameters only. Anything from a {@code {} on is ignored.
     *
     * @param signature The signature.
     * @return The definition.
     */
    @Contract(pure = true)
    @NotNull
    public static FunctionDefinition parseFunctionDefinition(String signature) {
        String text = Strings.trim(signature);
        int brace = text.indexOf('{');
        if (brace != -1) text = text.substring(0, brace);
        if (text.endsWith(";")) text = text.substring(0, text.length() - 1);

        int i = 0;
        int len = text.length();
        if (text.startsWith("gate")) i = "gate".length();
        while (i < len && Character.isWhitespace(text.charAt(i))) i++;
        int nameStart = i;
        while (i < len && !Character.isWhitespace(text.charAt(i)) && text.charAt(i) != '(') i++;
        String name = text.substring(nameStart, i);
        while (i < len && Character.isWhitespace(text.charAt(i))) i++;
        if (i < len && text.charAt(i) == '(') {
            int depth = 0;
            for (; i < len; i++) {
                char c = text.charAt(i);
                if (c == '(') depth++;
                else if (c == ')' && --depth == 0) {
                    i++;
                    break;
                }
            }
        }

        String parameters = Strings.removeWhitespace(text.substring(Math.min(i, len)));
        if (parameters.isEmpty()) {
            return new FunctionDefinition(name, new ArrayList<>());
        }
        return new FunctionDefinition(name, Strings.split(parameters, ','));
    }

    /**
     * Get the operations guarded by a classically controlled gate, {@code if (condition) op; ...}
     * or {@code if (condition) { op; ... }}. Blank operations are dropped.
     *
     * @param code The instruction text.
     * @return The operations, each terminated by {@code ;}.
     */
    @Contract(pure = true)
    @NotNull
    public static List<String> parseClassicControlled(String code) {
        String text = Strings.trim(code);
        if (text.startsWith("if")) text = Strings.trim(text.substring(2));

        // skip the parenthesised condition
        int depth = 0;
        int i = 0;
        for (; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (--depth == 0) break;
            }
        }

        String rest = i + 1 < text.length() ? text.substring(i + 1) : "";
        rest = rest.replace("{", "").replace("}", "");
        List<String> operations = new ArrayList<>();
        for (String operation : Strings.split(rest, ';')) {
            if (!Strings.trim(operation).isEmpty()) {
                operations.add(Strings.trim(operation) + ";");
            }
        }
        return operations;
    }

    /**
     * Find the names of every gate defined anywhere in some code, nested definitions included.
     *
     * @param code The code, with comments removed.
     * @return The gate names, in order of appearance.
     */
    @Contract(pure = true)
    @NotNull
    public static List<String> sweepFunctionNames(String code) {
        List<String> names = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= code.length(); i++) {
            if (i == code.length() || code.charAt(i) == ';' || code.charAt(i) == '{' || code.charAt(i) == '}') {
                String part = code.substring(start, i);
                if (InstructionKind.isFunctionDefinition(part)) {
                    names.add(parseFunctionDefinition(part).name);
                }
                start = i + 1;
            }
        }
        return names;
    }

    /**
     * Get the leading identifier of an instruction: everything up to the first whitespace or
     * {@code (}. This is the gate name for gate applications.
     *
     * @param code The instruction text.
     * @return The identifier, possibly empty.
     */
    @Contract(pure = true)
    @NotNull
    public static String leadingIdentifier(String code) {
        String text = Strings.trim(code);
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == '(' || c == ';') break;
            i++;
        }
        return text.substring(0, i);
    }

    /**
     * Get the variable an operand refers to, that is, the operand without any index suffix.
     *
     * @param operand The operand, e.g. {@code q[1]}.
     * @return The variable name, e.g. {@code q}.
     */
    @Contract(pure = true)
    @NotNull
    public static String variableName(String operand) {
        int open = operand.indexOf('[');
        return open == -1 ? operand : operand.substring(0, open);
    }
}
