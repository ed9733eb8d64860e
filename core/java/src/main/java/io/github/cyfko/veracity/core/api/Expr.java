package io.github.cyfko.veracity.core.api;

/**
 * A propositional-logic formula represented as an immutable expression tree.
 * <p>
 * The hierarchy is closed: every node kind is one of the permitted records below, and
 * every algorithm over the tree dispatches through {@link ExprVisitor}, so adding a node
 * kind is a compile error in each component until it is handled there.
 * </p>
 *
 * <table border="1">
 * <caption>Node kinds</caption>
 * <thead>
 * <tr><th>Node</th><th>Glyph</th><th>Children</th><th>Produced by</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>{@link Variable}</td><td>letter</td><td>none</td><td>parser</td></tr>
 * <tr><td>{@link Negation}</td><td>¬</td><td>operand</td><td>parser</td></tr>
 * <tr><td>{@link Conjunction}</td><td>∧</td><td>lhs, rhs</td><td>parser</td></tr>
 * <tr><td>{@link Disjunction}</td><td>∨</td><td>lhs, rhs</td><td>parser</td></tr>
 * <tr><td>{@link Implication}</td><td>→</td><td>premise, conclusion</td><td>parser</td></tr>
 * <tr><td>{@link Constant}</td><td>⊤ / ⊥</td><td>none</td><td>simplifier</td></tr>
 * </tbody>
 * </table>
 *
 * <p>
 * Equality is structural: two trees are equal when they have the same shape and the same
 * variable identifiers at the same positions.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Expr permits Variable, Negation, Conjunction, Disjunction, Implication, Constant {

    /**
     * Dispatches to the visitor method matching this node kind.
     *
     * @param visitor the visitor to apply
     * @param <R> the visitor result type
     * @return the visitor result for this node
     */
    <R> R accept(ExprVisitor<R> visitor);
}
