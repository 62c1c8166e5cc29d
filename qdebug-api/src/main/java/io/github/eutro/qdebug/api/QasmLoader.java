package io.github.eutro.qdebug.api;

import io.github.eutro.qdebug.parsing.ParsingException;
import io.github.eutro.qdebug.parsing.Preprocessor;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads programs for a debugger, reporting malformed programs as results rather than exceptions.
 */
public class QasmLoader {
    private final Preprocessor preprocessor;

    public QasmLoader() {
        this(new Preprocessor());
    }

    public QasmLoader(Preprocessor preprocessor) {
        this.preprocessor = preprocessor;
    }

    @NotNull
    public Preprocessor getPreprocessor() {
        return preprocessor;
    }

    /**
     * Load a program from text.
     *
     * @param code The program text.
     * @return The result.
     */
    @NotNull
    public LoadResult load(String code) {
        try {
            return LoadResult.ok(preprocessor.preprocess(code));
        } catch (ParsingException e) {
            return LoadResult.parseError(e);
        }
    }

    /**
     * Load a program from a UTF-8 file.
     *
     * @param path The path of the file.
     * @return The result.
     * @throws IOException If the file could not be read.
     */
    @NotNull
    public LoadResult load(Path path) throws IOException {
        return load(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }
}
