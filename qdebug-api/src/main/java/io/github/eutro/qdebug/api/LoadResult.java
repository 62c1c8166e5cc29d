package io.github.eutro.qdebug.api;

import io.github.eutro.qdebug.ir.Program;
import io.github.eutro.qdebug.parsing.ParsingErrorLocation;
import io.github.eutro.qdebug.parsing.ParsingException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The outcome of {@link QasmLoader#load(String) loading} a program: either the program,
 * or the position and text of the error that stopped it from loading.
 */
public final class LoadResult {
    private static final Pattern LOCATED_MESSAGE = Pattern.compile(
            Pattern.quote(ParsingException.INPUT_NAME) + ":(\\d+):(\\d+):\\s*(.*)",
            Pattern.DOTALL
    );

    public enum Status {
        OK,
        PARSE_ERROR,
    }

    private final Status status;
    private final int line;
    private final int column;
    private final String message;
    @Nullable
    private final Program program;

    private LoadResult(Status status, int line, int column, String message, @Nullable Program program) {
        this.status = status;
        this.line = line;
        this.column = column;
        this.message = message;
        this.program = program;
    }

    @NotNull
    public static LoadResult ok(Program program) {
        return new LoadResult(Status.OK, 0, 0, "", program);
    }

    /**
     * Create the result for a program that failed to parse.
     * <p>
     * Errors without a structured location have their position recovered from their message,
     * as with {@link #parseErrorLocation(String)}.
     *
     * @param error The error.
     * @return The result.
     */
    @NotNull
    public static LoadResult parseError(ParsingException error) {
        ParsingErrorLocation location = error.getLocation();
        if (location == null) location = parseErrorLocation(error.getMessage());
        return new LoadResult(Status.PARSE_ERROR, location.line, location.column, location.detail, null);
    }

    /**
     * Recover the location of an error from its formatted message,
     * {@code <input>:LINE:COLUMN: DETAIL}.
     * <p>
     * A message of any other shape is located at line 1, column 1, with the whole message as
     * the detail.
     *
     * @param message The message.
     * @return The location.
     */
    @NotNull
    public static ParsingErrorLocation parseErrorLocation(@Nullable String message) {
        String text = message == null ? "" : message;
        Matcher matcher = LOCATED_MESSAGE.matcher(text);
        if (matcher.matches()) {
            try {
                return new ParsingErrorLocation(
                        Integer.parseInt(matcher.group(1)),
                        Integer.parseInt(matcher.group(2)),
                        matcher.group(3)
                );
            } catch (NumberFormatException e) {
                return new ParsingErrorLocation(1, 1, text);
            }
        }
        return new ParsingErrorLocation(1, 1, text);
    }

    @NotNull
    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * Get the one-based line of the error, or 0 if loading succeeded.
     *
     * @return The line.
     */
    public int getLine() {
        return line;
    }

    /**
     * Get the one-based column of the error, or 0 if loading succeeded.
     *
     * @return The column.
     */
    public int getColumn() {
        return column;
    }

    /**
     * Get the detail of the error, without its location, or the empty string if loading succeeded.
     *
     * @return The message.
     */
    @NotNull
    public String getMessage() {
        return message;
    }

    /**
     * Get the loaded program.
     *
     * @return The program, or null if loading failed.
     */
    @Nullable
    public Program getProgram() {
        return program;
    }

    @Override
    public String toString() {
        return isOk() ? "OK" : ParsingException.format(new ParsingErrorLocation(line, column, message));
    }
}
