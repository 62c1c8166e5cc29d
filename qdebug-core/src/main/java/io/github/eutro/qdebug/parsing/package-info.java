/**
 * Turns program text into {@link io.github.eutro.qdebug.ir.Program programs}.
 * <p>
 * The entry point is {@link io.github.eutro.qdebug.parsing.Preprocessor}. Malformed programs are
 * reported by throwing a {@link io.github.eutro.qdebug.parsing.ParsingException}, located in
 * the original text.
 */
package io.github.eutro.qdebug.parsing;
