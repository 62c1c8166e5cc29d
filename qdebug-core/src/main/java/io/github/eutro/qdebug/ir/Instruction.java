package io.github.eutro.qdebug.ir;

import io.github.eutro.qdebug.assertion.Assertion;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A single instruction of the flattened program.
 * <p>
 * Instructions are numbered contiguously across the whole program, gate bodies included.
 * After construction, only the scope tag and the fields filled in by the
 * {@link io.github.eutro.qdebug.passes.Passes#LINK linking passes} change.
 */
public final class Instruction {
    /**
     * The {@link #getSuccessorIndex() successor} which means "return to the caller".
     */
    public static final int POP_CALL_STACK = 0;
    /**
     * The {@link #getEnclosingDefinition() enclosing definition} of top-level instructions.
     */
    public static final int TOP_LEVEL = -1;

    private final int index;
    private final String code;
    private final InstructionKind kind;
    @Nullable
    private final Assertion assertion;
    private final List<String> targets;
    private final int sourceStart;
    private final int sourceEnd;
    private final boolean functionCall;
    @Nullable
    private final String calledFunction;
    private final Block block;
    private final List<Integer> childInstructions;

    private int successorIndex;
    private int enclosingDefinition = TOP_LEVEL;
    private final Map<String, String> callSubstitution = new LinkedHashMap<>();
    private final List<DataDependency> dataDependencies = new ArrayList<>();

    private Instruction(Builder b) {
        index = b.index;
        code = b.code;
        kind = b.kind;
        assertion = b.assertion;
        targets = Collections.unmodifiableList(new ArrayList<>(b.targets));
        sourceStart = b.sourceStart;
        sourceEnd = b.sourceEnd;
        functionCall = b.calledFunction != null;
        calledFunction = b.calledFunction;
        block = b.block;
        childInstructions = Collections.unmodifiableList(new ArrayList<>(b.childInstructions));
        successorIndex = b.successorIndex == null ? index + 1 : b.successorIndex;
    }

    public static Builder builder(int index, InstructionKind kind, String code) {
        return new Builder(index, kind, code);
    }

    public int getIndex() {
        return index;
    }

    /**
     * Get the text of this instruction, without its block unless the block was inlined
     * (as it is for classically controlled gates).
     *
     * @return The code.
     */
    @NotNull
    public String getCode() {
        return code;
    }

    @NotNull
    public InstructionKind getKind() {
        return kind;
    }

    @Nullable
    public Assertion getAssertion() {
        return assertion;
    }

    public boolean isAssertion() {
        return assertion != null;
    }

    /**
     * Get the operands of this instruction, in order.
     *
     * @return The targets.
     */
    @NotNull
    public List<String> getTargets() {
        return targets;
    }

    /**
     * Get the offset of the first character of this instruction in the original program text.
     *
     * @return The offset.
     */
    public int getSourceStart() {
        return sourceStart;
    }

    /**
     * Get the offset of the last character of this instruction in the original program text,
     * that is, its semicolon or the closing brace of its block.
     *
     * @return The offset.
     */
    public int getSourceEnd() {
        return sourceEnd;
    }

    /**
     * Get the index of the instruction that runs after this one, or {@link #POP_CALL_STACK}.
     *
     * @return The successor index.
     */
    public int getSuccessorIndex() {
        return successorIndex;
    }

    public void setSuccessorIndex(int successorIndex) {
        this.successorIndex = successorIndex;
    }

    public boolean isFunctionCall() {
        return functionCall;
    }

    @Nullable
    public String getCalledFunction() {
        return calledFunction;
    }

    public boolean isFunctionDefinition() {
        return kind == InstructionKind.FUNCTION_DEFINITION;
    }

    public boolean isReturn() {
        return kind == InstructionKind.RETURN;
    }

    public boolean isInFunctionDefinition() {
        return enclosingDefinition != TOP_LEVEL;
    }

    /**
     * Get the index of the header of the innermost gate definition this instruction is part
     * of, or {@link #TOP_LEVEL}.
     *
     * @return The enclosing definition.
     */
    public int getEnclosingDefinition() {
        return enclosingDefinition;
    }

    /**
     * Tag this instruction as part of a gate body. Only the innermost definition is kept.
     *
     * @param definition The index of the definition header.
     */
    public void markInFunctionDefinition(int definition) {
        if (enclosingDefinition == TOP_LEVEL) {
            enclosingDefinition = definition;
        }
    }

    /**
     * Get the indices of the instructions of the body of this gate definition.
     *
     * @return The child instructions, empty unless this is a definition header.
     */
    @NotNull
    public List<Integer> getChildInstructions() {
        return childInstructions;
    }

    /**
     * Get the mapping from the called gate's parameter names to the arguments of this call.
     *
     * @return The call substitution, empty unless this is a resolved call.
     */
    @NotNull
    public Map<String, String> getCallSubstitution() {
        return Collections.unmodifiableMap(callSubstitution);
    }

    public void setCallSubstitution(Map<String, String> substitution) {
        callSubstitution.clear();
        callSubstitution.putAll(substitution);
    }

    @NotNull
    public List<DataDependency> getDataDependencies() {
        return Collections.unmodifiableList(dataDependencies);
    }

    public void addDataDependency(DataDependency dependency) {
        dataDependencies.add(dependency);
    }

    public void clearDataDependencies() {
        dataDependencies.clear();
    }

    @NotNull
    public Block getBlock() {
        return block;
    }

    @Override
    public String toString() {
        return index + ": " + code;
    }

    public static final class Builder {
        private final int index;
        private final InstructionKind kind;
        private final String code;
        private Assertion assertion;
        private List<String> targets = Collections.emptyList();
        private int sourceStart;
        private int sourceEnd;
        private Integer successorIndex;
        private String calledFunction;
        private Block block = Block.NONE;
        private List<Integer> childInstructions = Collections.emptyList();

        private Builder(int index, InstructionKind kind, String code) {
            this.index = index;
            this.kind = kind;
            this.code = code;
        }

        public Builder assertion(Assertion assertion) {
            this.assertion = assertion;
            return this;
        }

        public Builder targets(List<String> targets) {
            this.targets = targets;
            return this;
        }

        public Builder source(int start, int end) {
            this.sourceStart = start;
            this.sourceEnd = end;
            return this;
        }

        public Builder successor(int successorIndex) {
            this.successorIndex = successorIndex;
            return this;
        }

        public Builder calls(@Nullable String function) {
            this.calledFunction = function;
            return this;
        }

        public Builder block(Block block) {
            this.block = block;
            return this;
        }

        public Builder children(List<Integer> childInstructions) {
            this.childInstructions = childInstructions;
            return this;
        }

        public Instruction build() {
            return new Instruction(this);
        }
    }
}
