package io.github.eutro.qdebug.parsing;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Translates offsets in the original program text into one-based line/column positions.
 */
public final class SourceLocator {
    private final String source;

    /**
     * Create a locator for the given original program text.
     *
     * @param source The original program text.
     */
    public SourceLocator(String source) {
        this.source = source;
    }

    @Contract(pure = true)
    public int lineStart(int offset) {
        int clamped = Math.max(0, Math.min(offset, source.length()));
        // a newline at the offset itself still belongs to the line it ends
        return source.lastIndexOf('\n', clamped - 1) + 1;
    }

    @Contract(pure = true)
    public int lineEnd(int offset) {
        int nl = source.indexOf('\n', Math.max(0, offset));
        return nl == -1 ? source.length() : nl;
    }

    /**
     * Locate an offset.
     *
     * @param offset The zero-based offset.
     * @param detail The error detail.
     * @return The location.
     */
    @NotNull
    public ParsingErrorLocation locate(int offset, String detail) {
        int lineStart = lineStart(offset);
        int line = 1;
        for (int i = 0; i < lineStart; i++) {
            if (source.charAt(i) == '\n') line++;
        }
        return new ParsingErrorLocation(line, Math.max(offset, lineStart) - lineStart + 1, detail);
    }

    /**
     * Locate a target token on the line containing an offset.
     * <p>
     * The column is that of the first occurrence of {@code target} on the line. If the target
     * is not written out verbatim on the line, the column of the first non-blank character
     * of the line is used instead.
     *
     * @param offset The zero-based offset, usually the start of an instruction.
     * @param target The target text, or null.
     * @param detail The error detail.
     * @return The location.
     */
    @NotNull
    public ParsingErrorLocation locate(int offset, @Nullable String target, String detail) {
        ParsingErrorLocation at = locate(offset, detail);
        int lineStart = lineStart(offset);
        String lineText = source.substring(lineStart, Math.max(lineStart, lineEnd(lineStart)));
        if (target != null && !target.isEmpty()) {
            int found = lineText.indexOf(target);
            if (found != -1) {
                return new ParsingErrorLocation(at.line, found + 1, detail);
            }
        }
        for (int i = 0; i < lineText.length(); i++) {
            char c = lineText.charAt(i);
            if (c != ' ' && c != '\t') {
                return new ParsingErrorLocation(at.line, i + 1, detail);
            }
        }
        return at;
    }

    /**
     * Create an exception located at an offset.
     *
     * @param kind   The kind of error.
     * @param offset The offset.
     * @param target The target to point at, or null.
     * @param detail The error detail.
     * @return The exception.
     */
    @NotNull
    public ParsingException error(ParsingException.Kind kind, int offset, @Nullable String target, String detail) {
        return new ParsingException(kind, target == null ? locate(offset, detail) : locate(offset, target, detail));
    }
}
