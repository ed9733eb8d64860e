package io.github.cyfko.veracity.core.api;

import java.util.Objects;

/**
 * Logical negation {@code ¬operand}.
 *
 * @param operand the negated expression
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Negation(Expr operand) implements Expr {

    public Negation {
        Objects.requireNonNull(operand, "operand cannot be null");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNegation(this);
    }
}
