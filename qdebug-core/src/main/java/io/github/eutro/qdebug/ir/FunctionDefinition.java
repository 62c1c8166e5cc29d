package io.github.eutro.qdebug.ir;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A user-defined gate: its name and its formal qubit parameters, in order.
 */
public final class FunctionDefinition {
    public final String name;
    public final List<String> parameters;

    public FunctionDefinition(String name, List<String> parameters) {
        this.name = name;
        this.parameters = Collections.unmodifiableList(parameters);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunctionDefinition that = (FunctionDefinition) o;
        return name.equals(that.name) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters);
    }

    @Override
    public String toString() {
        return "gate " + name + " " + String.join(", ", parameters);
    }
}
