package io.github.cyfko.veracity.core.api;

/**
 * A propositional variable. Leaf of every expression tree.
 * <p>
 * Two variables with the same identifier are interchangeable, in particular as keys of an
 * {@link Assignment}.
 * </p>
 *
 * @param identifier the variable name; the lexer only produces single letters
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Variable(String identifier) implements Expr, Symbol {

    public Variable {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Variable identifier is required");
        }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return identifier;
    }
}
