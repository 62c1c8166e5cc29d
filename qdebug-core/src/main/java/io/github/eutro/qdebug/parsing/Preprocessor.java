package io.github.eutro.qdebug.parsing;

import io.github.eutro.qdebug.assertion.Assertion;
import io.github.eutro.qdebug.assertion.AssertionParser;
import io.github.eutro.qdebug.assertion.AssertionSyntaxException;
import io.github.eutro.qdebug.assertion.DefaultAssertionParser;
import io.github.eutro.qdebug.ir.*;
import io.github.eutro.qdebug.passes.IRPass;
import io.github.eutro.qdebug.passes.Passes;
import io.github.eutro.qdebug.passes.meta.CheckInstructions;
import io.github.eutro.qdebug.util.Strings;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns program text into a flat {@link Program}.
 * <p>
 * Each level of the program (the top level, or the body of a gate) is sanitized and split into
 * instructions, which are classified, have their operands extracted and validated, and are
 * appended to a single instruction list. Gate definitions are inlined recursively where they
 * are written, as a header, the body, and a {@link InstructionKind#RETURN RETURN} marker.
 * Once the whole list exists, the {@link Passes#LINK linking passes} resolve calls and data
 * dependencies.
 * <p>
 * A preprocessor holds only configuration, and may be used for any number of programs.
 */
public class Preprocessor {
    /**
     * Whether preprocessors verify the structure of the programs they produce, unless
     * {@link #setVerify(boolean) configured} otherwise.
     */
    public static boolean VERIFY_BY_DEFAULT = System.getenv("QDEBUG_VERIFY_IR") != null;

    private AssertionParser assertionParser = DefaultAssertionParser.INSTANCE;
    private boolean verify = VERIFY_BY_DEFAULT;

    @NotNull
    public AssertionParser getAssertionParser() {
        return assertionParser;
    }

    public Preprocessor setAssertionParser(@NotNull AssertionParser assertionParser) {
        this.assertionParser = assertionParser;
        return this;
    }

    public boolean isVerify() {
        return verify;
    }

    /**
     * Set whether to run {@link CheckInstructions} over every program produced.
     *
     * @param verify Whether to verify programs.
     * @return This preprocessor.
     */
    public Preprocessor setVerify(boolean verify) {
        this.verify = verify;
        return this;
    }

    /**
     * Preprocess a program.
     *
     * @param code The program text.
     * @return The program.
     * @throws ParsingException If the program is malformed.
     */
    @NotNull
    public Program preprocess(String code) {
        Run run = new Run(code);
        Scope root = Scope.root();
        SanitizedSource source = Sanitizer.sanitize(code, 0);
        List<Instruction> instructions = run.preprocessLevel(source, root);
        Program program = new Program(
                code,
                source.commentFree,
                instructions,
                root.getRegisters(),
                run.functions,
                run.definitionHeaders,
                run.localDefinitions
        );
        IRPass<Program, Program> passes = Passes.LINK;
        if (verify) passes = passes.then(CheckInstructions.INSTANCE);
        return passes.run(program);
    }

    private class Run {
        final SourceLocator locator;
        final TargetValidator validator;
        final Map<String, FunctionDefinition> functions = new LinkedHashMap<>();
        final Map<String, Integer> definitionHeaders = new LinkedHashMap<>();
        final Map<Integer, Map<String, Integer>> localDefinitions = new HashMap<>();
        int nextIndex = 0;

        Run(String code) {
            locator = new SourceLocator(code);
            validator = new TargetValidator(locator);
        }

        List<Instruction> preprocessLevel(SanitizedSource source, Scope scope) {
            scope.addFunctionNames(Operands.sweepFunctionNames(source.commentFree));
            List<Instruction> out = new ArrayList<>();
            String text = source.text;
            List<SourceBlock> blocks = source.blocks;
            int pos = 0;
            int nextBlock = 0;
            while (true) {
                int semi = text.indexOf(';', pos);
                SourceBlock block = nextBlock < blocks.size() ? blocks.get(nextBlock) : null;
                int end;
                if (block != null && (semi == -1 || block.position <= semi)) {
                    end = block.position;
                    nextBlock++;
                } else if (semi != -1) {
                    end = semi;
                    block = null;
                } else {
                    break;
                }

                String line = block == null ? text.substring(pos, end + 1) : text.substring(pos, end);
                int first = pos;
                while (first < end && Strings.isBlank(text.charAt(first))) first++;
                int sourceStart;
                if (first < end || block == null) {
                    sourceStart = source.map.toOriginal(first);
                } else {
                    sourceStart = block.originalOpen;
                }
                int sourceEnd = block == null ? source.map.toOriginal(end) : block.originalClose;

                instruction(out, line, sourceStart, sourceEnd, block, scope);
                pos = block == null ? end + 1 : end;
            }
            return out;
        }

        void instruction(List<Instruction> out, String line, int sourceStart, int sourceEnd, SourceBlock sourceBlock, Scope scope) {
            String code = Strings.trim(line);
            Block block = sourceBlock == null ? Block.NONE : Block.of(sourceBlock.content);
            InstructionKind kind = InstructionKind.classify(code, assertionParser);

            if (kind == InstructionKind.FUNCTION_DEFINITION) {
                inlineDefinition(out, code, sourceStart, sourceEnd, sourceBlock, scope);
                return;
            }
            if (kind == InstructionKind.CLASSIC_CONTROLLED && block.valid) {
                code = code + " { " + block.code + " }";
                block = Block.NONE;
            }

            List<String> targets = Operands.parse(code);
            Assertion assertion = null;
            String called = null;
            switch (kind) {
                case VARIABLE_DECLARATION:
                    validator.declareRegister(sourceStart, code, scope);
                    break;
                case ASSERTION:
                    assertion = parseAssertion(code, block, sourceStart, scope);
                    targets = assertion.getTargetQubits();
                    break;
                case PLAIN_GATE:
                    String name = Operands.leadingIdentifier(code);
                    if (scope.isFunction(name)) called = name;
                    // fallthrough
                default:
                    validator.validateTargets(sourceStart, targets, scope, "");
            }

            out.add(Instruction.builder(nextIndex++, kind, code)
                    .assertion(assertion)
                    .targets(targets)
                    .source(sourceStart, sourceEnd)
                    .calls(called)
                    .block(block)
                    .build());
        }

        Assertion parseAssertion(String code, Block block, int sourceStart, Scope scope) {
            Assertion assertion;
            try {
                assertion = assertionParser.parse(code, block.code);
                assertion.setTargetQubits(unfold(assertion.getTargetQubits(), scope));
                assertion.validate();
            } catch (AssertionSyntaxException e) {
                throw new ParsingException(
                        ParsingException.Kind.INVALID_ASSERTION,
                        locator.locate(sourceStart, e.getMessage()),
                        e
                );
            }
            validator.validateTargets(sourceStart, assertion.getTargetQubits(), scope, " in assertion");
            return assertion;
        }

        List<String> unfold(List<String> targets, Scope scope) {
            List<String> unfolded = new ArrayList<>();
            for (String target : targets) {
                Integer size = scope.getRegisters().get(target);
                if (size == null || scope.isShadowed(target)) {
                    unfolded.add(target);
                    continue;
                }
                for (int i = 0; i < size; i++) {
                    unfolded.add(target + "[" + i + "]");
                }
            }
            return unfolded;
        }

        void inlineDefinition(List<Instruction> out, String code, int sourceStart, int sourceEnd, SourceBlock sourceBlock, Scope scope) {
            if (sourceBlock == null) {
                throw locator.error(
                        ParsingException.Kind.MISSING_BODY_BLOCK,
                        sourceStart,
                        null,
                        "Gate definitions require a body block."
                );
            }
            FunctionDefinition definition = Operands.parseFunctionDefinition(code);
            int header = nextIndex++;
            functions.putIfAbsent(definition.name, definition);
            definitionHeaders.putIfAbsent(definition.name, header);
            localDefinitions.computeIfAbsent(scope.getEnclosingDefinition(), k -> new LinkedHashMap<>())
                    .putIfAbsent(definition.name, header);

            Scope inner = scope.enterFunction(header, definition.parameters);
            SanitizedSource body = Sanitizer.sanitize(sourceBlock.content, sourceBlock.originalOpen + 1);
            List<Instruction> bodyInstructions = preprocessLevel(body, inner);
            List<Integer> children = new ArrayList<>(bodyInstructions.size());
            for (Instruction insn : bodyInstructions) {
                insn.markInFunctionDefinition(header);
                children.add(insn.getIndex());
            }

            int ret = nextIndex++;
            out.add(Instruction.builder(header, InstructionKind.FUNCTION_DEFINITION, code)
                    .targets(definition.parameters)
                    .source(sourceStart, sourceEnd)
                    .successor(ret + 1)
                    .block(Block.of(sourceBlock.content))
                    .children(children)
                    .build());
            out.addAll(bodyInstructions);
            Instruction returnInsn = Instruction.builder(ret, InstructionKind.RETURN, "RETURN")
                    .targets(definition.parameters)
                    .source(sourceBlock.originalClose, sourceBlock.originalClose)
                    .successor(Instruction.POP_CALL_STACK)
                    .build();
            returnInsn.markInFunctionDefinition(header);
            out.add(returnInsn);
        }
    }
}
