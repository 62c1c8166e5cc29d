package io.github.eutro.qdebug.parsing;

import io.github.eutro.qdebug.util.Strings;
import org.jetbrains.annotations.NotNull;

import java.util.List;

import static io.github.eutro.qdebug.parsing.ParsingException.Kind.*;

/**
 * Checks operands and register declarations against the registers declared so far.
 */
public final class TargetValidator {
    private final SourceLocator locator;

    public TargetValidator(SourceLocator locator) {
        this.locator = locator;
    }

    /**
     * Validate the targets of an instruction.
     * <p>
     * Targets without an index are not checked against the registers. An indexed target
     * {@code name[idx]} must have a non-empty name and an all-digit index closing the target,
     * and, unless {@code name} is shadowed by a gate parameter, {@code name} must be a
     * register of size greater than {@code idx}.
     *
     * @param instructionStart The offset of the instruction in the original text.
     * @param targets          The targets.
     * @param scope            The scope of the instruction.
     * @param context          Text to append to error details, e.g. {@code " in assertion"}.
     * @throws ParsingException If a target is invalid.
     */
    public void validateTargets(int instructionStart, List<String> targets, Scope scope, String context) {
        for (String target : targets) {
            if (target.isEmpty()) {
                throw locator.error(EMPTY_TARGET, instructionStart, null, "Empty target" + context + ".");
            }
            int open = target.indexOf('[');
            if (open == -1) continue;
            int close = target.indexOf(']', open + 1);
            if (open == 0 || close == -1 || close != target.length() - 1) {
                throw invalidTarget(instructionStart, target, context, null);
            }
            String registerName = target.substring(0, open);
            String indexText = target.substring(open + 1, close);
            if (!Strings.isDigits(indexText)) {
                throw invalidTarget(instructionStart, target, context, null);
            }
            int index;
            try {
                index = Integer.parseInt(indexText);
            } catch (NumberFormatException e) {
                throw invalidTarget(instructionStart, target, context, e);
            }
            if (scope.isShadowed(registerName)) continue;
            Integer size = scope.getRegisters().get(registerName);
            if (size == null || size <= index) {
                throw invalidTarget(instructionStart, target, context, null);
            }
        }
    }

    /**
     * Validate a register declaration, and declare the register in the scope.
     *
     * @param instructionStart The offset of the declaration in the original text.
     * @param code             The declaration, e.g. {@code qreg q[2];}.
     * @param scope            The scope to declare the register in.
     * @throws ParsingException If the declaration is invalid.
     */
    public void declareRegister(int instructionStart, String code, Scope scope) {
        String trimmed = Strings.trim(code);
        String declaration = Strings.removeWhitespace(trimmed.substring("qreg".length()));
        if (declaration.endsWith(";")) declaration = declaration.substring(0, declaration.length() - 1);
        int open = declaration.indexOf('[');
        String name = open == -1 ? declaration : declaration.substring(0, open);
        String sizeText = "";
        if (open != -1) {
            int close = declaration.indexOf(']', open + 1);
            sizeText = declaration.substring(open + 1, close == -1 ? declaration.length() : close);
        }
        if (name.isEmpty() || !Strings.isDigits(sizeText)) {
            throw invalidRegister(instructionStart, trimmed, null);
        }
        int size;
        try {
            size = Integer.parseInt(sizeText);
        } catch (NumberFormatException e) {
            throw invalidRegister(instructionStart, trimmed, e);
        }
        scope.declareRegister(name, size);
    }

    @NotNull
    private ParsingException invalidTarget(int instructionStart, String target, String context, Throwable cause) {
        String detail = "Invalid target qubit " + target + context + ".";
        return new ParsingException(INVALID_TARGET_QUBIT, locator.locate(instructionStart, target, detail), cause);
    }

    @NotNull
    private ParsingException invalidRegister(int instructionStart, String declaration, Throwable cause) {
        String detail = "Invalid register declaration " + declaration + ".";
        return new ParsingException(INVALID_REGISTER_DECLARATION, locator.locate(instructionStart, detail), cause);
    }
}
