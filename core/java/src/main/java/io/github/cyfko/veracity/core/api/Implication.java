package io.github.cyfko.veracity.core.api;

import java.util.Objects;

/**
 * Material implication {@code premise → conclusion}.
 *
 * @param premise the left-hand side as written
 * @param conclusion the right-hand side as written
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Implication(Expr premise, Expr conclusion) implements Expr {

    public Implication {
        Objects.requireNonNull(premise, "premise cannot be null");
        Objects.requireNonNull(conclusion, "conclusion cannot be null");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitImplication(this);
    }
}
