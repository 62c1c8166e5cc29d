/**
 * Passes over the flat instruction list of a {@link io.github.eutro.qdebug.ir.Program}.
 * <p>
 * These run after every instruction of a program has been constructed, and are the only code
 * that mutates instructions after construction.
 */
package io.github.eutro.qdebug.passes;
