package io.github.eutro.qdebug.parsing;

import java.util.Objects;

/**
 * A position in the original program text that a {@link ParsingException} refers to.
 */
public final class ParsingErrorLocation {
    /**
     * The one-based line.
     */
    public final int line;
    /**
     * The one-based column.
     */
    public final int column;
    /**
     * The undecorated error detail.
     */
    public final String detail;

    public ParsingErrorLocation(int line, int column, String detail) {
        this.line = line;
        this.column = column;
        this.detail = detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParsingErrorLocation that = (ParsingErrorLocation) o;
        return line == that.line && column == that.column && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column, detail);
    }

    @Override
    public String toString() {
        return line + ":" + column + ": " + detail;
    }
}
