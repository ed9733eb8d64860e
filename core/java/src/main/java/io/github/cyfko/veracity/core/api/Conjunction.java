package io.github.cyfko.veracity.core.api;

import java.util.Objects;

/**
 * Logical conjunction {@code ∧}.
 * <p>
 * The parser stores the operand that appears last in the source text as {@code lhs}, so
 * {@code P∧Q} parses to {@code Conjunction(lhs=Q, rhs=P)}. Evaluation does not depend on
 * the order, structural equality does.
 * </p>
 *
 * @param lhs the most recently parsed operand
 * @param rhs the earlier operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Conjunction(Expr lhs, Expr rhs) implements Expr {

    public Conjunction {
        Objects.requireNonNull(lhs, "lhs cannot be null");
        Objects.requireNonNull(rhs, "rhs cannot be null");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitConjunction(this);
    }
}
