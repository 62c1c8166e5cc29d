package io.github.eutro.qdebug.parsing;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a program cannot be preprocessed.
 * <p>
 * All of these are fatal to the whole preprocessing call. Exceptions thrown while
 * preprocessing a gate body are propagated as they are, so the location always refers
 * to the original program text.
 */
public class ParsingException extends RuntimeException {
    /**
     * The name used for the program text in formatted messages.
     */
    public static final String INPUT_NAME = "<input>";

    /**
     * The kind of parsing error.
     */
    public enum Kind {
        MISSING_BODY_BLOCK,
        INVALID_REGISTER_DECLARATION,
        EMPTY_TARGET,
        INVALID_TARGET_QUBIT,
        ARITY_MISMATCH,
        INVALID_ASSERTION,
    }

    private final Kind kind;
    private final String detail;
    @Nullable
    private final ParsingErrorLocation location;

    public ParsingException(@NotNull Kind kind, @NotNull ParsingErrorLocation location) {
        super(format(location));
        this.kind = kind;
        this.detail = location.detail;
        this.location = location;
    }

    public ParsingException(@NotNull Kind kind, @NotNull String detail) {
        super(detail);
        this.kind = kind;
        this.detail = detail;
        this.location = null;
    }

    public ParsingException(@NotNull Kind kind, @NotNull ParsingErrorLocation location, Throwable cause) {
        this(kind, location);
        initCause(cause);
    }

    /**
     * Format a location the way it is shown to users: {@code <input>:LINE:COLUMN: DETAIL}.
     *
     * @param location The location.
     * @return The formatted message.
     */
    public static String format(ParsingErrorLocation location) {
        return INPUT_NAME + ":" + location.line + ":" + location.column + ": " + location.detail;
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }

    /**
     * Get the error text, without any location prefix.
     *
     * @return The detail.
     */
    @NotNull
    public String getDetail() {
        return detail;
    }

    /**
     * Get the location of this error in the original program text, if it is known.
     *
     * @return The location, or null.
     */
    @Nullable
    public ParsingErrorLocation getLocation() {
        return location;
    }
}
