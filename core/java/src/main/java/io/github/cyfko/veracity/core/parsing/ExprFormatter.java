package io.github.cyfko.veracity.core.parsing;

import io.github.cyfko.veracity.core.api.Conjunction;
import io.github.cyfko.veracity.core.api.Constant;
import io.github.cyfko.veracity.core.api.Disjunction;
import io.github.cyfko.veracity.core.api.Expr;
import io.github.cyfko.veracity.core.api.ExprVisitor;
import io.github.cyfko.veracity.core.api.Implication;
import io.github.cyfko.veracity.core.api.Negation;
import io.github.cyfko.veracity.core.api.Token;
import io.github.cyfko.veracity.core.api.Variable;

import java.util.Objects;

/**
 * Renders an {@link Expr} as a fully parenthesised formula.
 * <p>
 * Conjunctions and disjunctions print {@code rhs} before {@code lhs}, which is the order
 * their operands appeared in the parsed text, so re-parsing the output yields an equal
 * tree:
 * </p>
 * <pre>{@code
 * stringify(parse("P∨Q∧¬R"));   // "(P ∨ (Q ∧ (¬R)))"
 * }</pre>
 * Constants print as {@value #TRUE} and {@value #FALSE}; the lexer ignores both glyphs.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExprFormatter {

    /** Rendering of {@link Constant#TRUE}. */
    public static final String TRUE = "⊤";

    /** Rendering of {@link Constant#FALSE}. */
    public static final String FALSE = "⊥";

    private static final ExprVisitor<String> RENDERER = new ExprVisitor<>() {
        @Override
        public String visitVariable(Variable variable) {
            return variable.identifier();
        }

        @Override
        public String visitNegation(Negation negation) {
            return "(" + Token.NEGATION.glyph() + negation.operand().accept(this) + ")";
        }

        @Override
        public String visitConjunction(Conjunction conjunction) {
            return binary(conjunction.rhs(), Token.CONJUNCTION, conjunction.lhs());
        }

        @Override
        public String visitDisjunction(Disjunction disjunction) {
            return binary(disjunction.rhs(), Token.DISJUNCTION, disjunction.lhs());
        }

        @Override
        public String visitImplication(Implication implication) {
            return binary(implication.premise(), Token.IMPLICATION, implication.conclusion());
        }

        @Override
        public String visitConstant(Constant constant) {
            return constant.value() ? TRUE : FALSE;
        }

        private String binary(Expr left, Token operator, Expr right) {
            return "(" + left.accept(this) + " " + operator.glyph() + " " + right.accept(this) + ")";
        }
    };

    private ExprFormatter() {}

    public static String stringify(Expr expr) {
        Objects.requireNonNull(expr, "expr cannot be null");
        return expr.accept(RENDERER);
    }
}
