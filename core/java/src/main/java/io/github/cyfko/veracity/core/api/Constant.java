package io.github.cyfko.veracity.core.api;

/**
 * A boolean constant. Never produced by the parser; the simplifier uses it to report a
 * subtree whose value is fixed, most notably {@link #FALSE} for an unsatisfiable formula.
 *
 * @param value the constant truth value
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Constant(boolean value) implements Expr {

    /** The constant {@code ⊤}. */
    public static final Constant TRUE = new Constant(true);

    /** The constant {@code ⊥}. */
    public static final Constant FALSE = new Constant(false);

    public static Constant of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }
}
