package io.github.eutro.qdebug.ir;

/**
 * A backward data-dependency edge: the operand at {@link #operand} of instruction
 * {@link #instruction} is the nearest earlier use of a variable.
 */
public final class DataDependency {
    public final int instruction;
    public final int operand;

    public DataDependency(int instruction, int operand) {
        this.instruction = instruction;
        this.operand = operand;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DataDependency that = (DataDependency) o;
        return instruction == that.instruction && operand == that.operand;
    }

    @Override
    public int hashCode() {
        return 31 * instruction + operand;
    }

    @Override
    public String toString() {
        return "(" + instruction + ", " + operand + ")";
    }
}
