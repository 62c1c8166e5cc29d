package io.github.eutro.qdebug.passes;

import io.github.eutro.qdebug.ir.Instruction;
import io.github.eutro.qdebug.ir.Program;
import io.github.eutro.qdebug.parsing.Operands;
import io.github.eutro.qdebug.parsing.ParsingException;
import io.github.eutro.qdebug.parsing.SourceLocator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Points every call of a user-defined gate at the first instruction of the gate's body,
 * and pairs the gate's parameters with the arguments of the call.
 * <p>
 * A call refers to the nearest definition of its name, looking in its own body first and then
 * in each enclosing body outwards. See {@link Program#resolveDefinition(String, int)}.
 * <p>
 * The first instruction of an empty body is the {@code RETURN} marker.
 */
public class ResolveCalls implements InPlaceIRPass<Program> {
    public static final ResolveCalls INSTANCE = new ResolveCalls();

    /**
     * {@inheritDoc}
     *
     * @throws ParsingException With {@link ParsingException.Kind#ARITY_MISMATCH} if a call has a
     *                          different number of arguments than the gate has parameters.
     */
    @Override
    public void runInPlace(Program program) {
        SourceLocator locator = null;
        for (Instruction insn : program.getInstructions()) {
            if (!insn.isFunctionCall()) continue;
            String name = insn.getCalledFunction();
            Instruction header = program.resolveDefinition(name, insn.getEnclosingDefinition());
            if (header == null) continue;
            insn.setSuccessorIndex(header.getIndex() + 1);

            List<String> parameters = header.getTargets();
            List<String> arguments = Operands.parse(insn.getCode());
            if (arguments.size() != parameters.size()) {
                if (locator == null) locator = new SourceLocator(program.getSource());
                throw locator.error(
                        ParsingException.Kind.ARITY_MISMATCH,
                        insn.getSourceStart(),
                        null,
                        "Custom gate call uses incorrect number of arguments."
                );
            }
            Map<String, String> substitution = new LinkedHashMap<>();
            for (int i = 0; i < arguments.size(); i++) {
                substitution.put(parameters.get(i), arguments.get(i));
            }
            insn.setCallSubstitution(substitution);
        }
    }
}
