/**
 * This package defines the flat instruction list a program is preprocessed into.
 * <p>
 * A {@link io.github.eutro.qdebug.ir.Program} holds every
 * {@link io.github.eutro.qdebug.ir.Instruction} in one list, numbered contiguously from zero.
 * Gate definitions are laid out where they are written: a header which is never executed,
 * the instructions of the body, and a {@link io.github.eutro.qdebug.ir.InstructionKind#RETURN RETURN}
 * marker whose successor is {@link io.github.eutro.qdebug.ir.Instruction#POP_CALL_STACK}.
 * A call of a gate continues at the first instruction of its body, and the caller is resumed
 * once the marker is reached.
 * <p>
 * All source offsets refer to the program text as it was given, comments and blocks included.
 */
package io.github.eutro.qdebug.ir;
