package io.github.eutro.qdebug.assertion;

import org.jetbrains.annotations.NotNull;

/**
 * Recognises and parses assertion instructions.
 * <p>
 * The preprocessor only relies on this interface, so the assertion grammar can be swapped
 * out entirely.
 */
public interface AssertionParser {
    /**
     * Check whether an instruction is an assertion.
     *
     * @param code The instruction text.
     * @return Whether it is an assertion.
     */
    boolean isAssertion(String code);

    /**
     * Parse an assertion.
     *
     * @param code      The instruction text, without its block.
     * @param blockCode The text of the instruction's block, or the empty string if there was none.
     * @return The assertion.
     * @throws AssertionSyntaxException If the assertion is malformed.
     */
    @NotNull
    Assertion parse(String code, String blockCode);
}
