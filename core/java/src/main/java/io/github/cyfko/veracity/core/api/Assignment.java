package io.github.cyfko.veracity.core.api;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable partial truth assignment mapping {@link Variable}s to boolean values.
 * <p>
 * Variables that are not bound are unconstrained: any value keeps the formula at its
 * target value. Binding a variable returns a new assignment that shares every existing
 * binding with its parent, so the solver can fork an assignment at a disjunction without
 * copying it and without one branch observing the other's bindings.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Assignment a = Assignment.empty().bind(new Variable("P"), true);
 * Assignment b = a.bind(new Variable("Q"), false);
 *
 * a.isBound(new Variable("Q"));   // false, a is unchanged
 * b.asMap();                      // {P=true, Q=false}
 * }</pre>
 *
 * <p>
 * Equality is by bindings only; binding order does not matter.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Assignment {

    private static final Assignment EMPTY = new Assignment(null, null, false, 0);

    private final Assignment parent;
    private final Variable variable;
    private final boolean value;
    private final int size;

    private Assignment(Assignment parent, Variable variable, boolean value, int size) {
        this.parent = parent;
        this.variable = variable;
        this.value = value;
        this.size = size;
    }

    /**
     * Returns the assignment with no bindings.
     *
     * @return the empty assignment
     */
    public static Assignment empty() {
        return EMPTY;
    }

    /**
     * Builds an assignment holding the given bindings, in the map's iteration order.
     *
     * @param bindings the variable values to bind
     * @return a new assignment
     * @throws NullPointerException if the map or one of its keys or values is null
     */
    public static Assignment of(Map<Variable, Boolean> bindings) {
        Objects.requireNonNull(bindings, "bindings cannot be null");
        Assignment result = EMPTY;
        for (Map.Entry<Variable, Boolean> entry : bindings.entrySet()) {
            result = result.bind(entry.getKey(), Objects.requireNonNull(entry.getValue(), "value cannot be null"));
        }
        return result;
    }

    /**
     * Looks up the value bound to a variable.
     *
     * @param variable the variable to look up
     * @return the bound value, or empty if the variable is unconstrained
     */
    public Optional<Boolean> get(Variable variable) {
        for (Assignment node = this; node.variable != null; node = node.parent) {
            if (node.variable.equals(variable)) {
                return Optional.of(node.value);
            }
        }
        return Optional.empty();
    }

    public boolean isBound(Variable variable) {
        return get(variable).isPresent();
    }

    /**
     * Returns an assignment that additionally binds {@code variable} to {@code value}.
     * <p>
     * Binding a variable to the value it already holds returns this instance.
     * </p>
     *
     * @param variable the variable to bind
     * @param value its truth value
     * @return the extended assignment
     * @throws IllegalStateException if the variable is already bound to the opposite value
     */
    public Assignment bind(Variable variable, boolean value) {
        Objects.requireNonNull(variable, "variable cannot be null");
        Optional<Boolean> current = get(variable);
        if (current.isPresent()) {
            if (current.get() != value) {
                throw new IllegalStateException(String.format(
                        "Variable '%s' is already bound to %s", variable, current.get()));
            }
            return this;
        }
        return new Assignment(this, variable, value, size + 1);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the bindings as an unmodifiable map, in binding order.
     *
     * @return the bound variables and their values
     */
    public Map<Variable, Boolean> asMap() {
        Deque<Assignment> chain = new ArrayDeque<>(size);
        for (Assignment node = this; node.variable != null; node = node.parent) {
            chain.push(node);
        }
        Map<Variable, Boolean> result = new LinkedHashMap<>(size * 2);
        for (Assignment node : chain) {
            result.put(node.variable, node.value);
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment)) return false;
        Assignment other = (Assignment) o;
        return size == other.size && asMap().equals(other.asMap());
    }

    @Override
    public int hashCode() {
        return asMap().hashCode();
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
