package io.github.cyfko.veracity.core.api;

import java.util.Objects;

/**
 * Logical disjunction {@code ∨}. Operand order follows {@link Conjunction}.
 *
 * @param lhs the most recently parsed operand
 * @param rhs the earlier operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Disjunction(Expr lhs, Expr rhs) implements Expr {

    public Disjunction {
        Objects.requireNonNull(lhs, "lhs cannot be null");
        Objects.requireNonNull(rhs, "rhs cannot be null");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitDisjunction(this);
    }
}
