package io.github.cyfko.veracity.core.api;

/**
 * Exhaustive per-node dispatch over an {@link Expr} tree.
 *
 * @param <R> the result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExprVisitor<R> {

    R visitVariable(Variable variable);

    R visitNegation(Negation negation);

    R visitConjunction(Conjunction conjunction);

    R visitDisjunction(Disjunction disjunction);

    R visitImplication(Implication implication);

    R visitConstant(Constant constant);
}
