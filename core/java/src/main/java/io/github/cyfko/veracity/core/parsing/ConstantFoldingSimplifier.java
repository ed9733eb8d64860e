package io.github.cyfko.veracity.core.parsing;

import io.github.cyfko.veracity.core.api.Conjunction;
import io.github.cyfko.veracity.core.api.Constant;
import io.github.cyfko.veracity.core.api.Disjunction;
import io.github.cyfko.veracity.core.api.Expr;
import io.github.cyfko.veracity.core.api.ExprVisitor;
import io.github.cyfko.veracity.core.api.Implication;
import io.github.cyfko.veracity.core.api.Negation;
import io.github.cyfko.veracity.core.api.Variable;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Removes constant-valued subtrees from a formula that is required to be true.
 * <p>
 * Each pass walks the tree once, carrying the value each subtree must take, and
 * records the first value every variable is forced to. A variable later required to take
 * the opposite value makes its subtree unsatisfiable. Unsatisfiable subtrees are then
 * folded away:
 * </p>
 * <ul>
 *   <li>Disjunction: replaced by its first satisfiable side ({@code lhs} preferred)</li>
 *   <li>Conjunction: becomes ⊥ when either side is unsatisfiable</li>
 *   <li>Negation and implication: shape kept, children simplified</li>
 *   <li>Whole formula unsatisfiable: ⊥</li>
 * </ul>
 *
 * <pre>{@code
 * simplify(parse("P∧¬P"));       // Constant.FALSE
 * simplify(parse("(P∧¬P)∨Q"));   // Variable(Q)
 * }</pre>
 *
 * <p>
 * The propagation rules are those of a forced-true chain rather than full boolean
 * semantics: a conjunction forces both sides true whatever it is required to be, a
 * disjunction evaluates both sides as if required true, and an implication requires both
 * sides to take its own required value. The input tree is never modified; simplified
 * subtrees are new nodes and untouched subtrees are shared with the input.
 * </p>
 * <p>
 * Replacing a disjunction by one side can expose a conflict that the pass did not see,
 * e.g. {@code Q∧¬(R∨Q)} first becomes {@code Q∧¬Q}. Passes are therefore repeated until
 * the tree stops changing. Every pass either returns an equal tree or a smaller one, so
 * the loop terminates and the result is a fixed point.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ConstantFoldingSimplifier {

    private ConstantFoldingSimplifier() {}

    /**
     * Simplifies an expression under the requirement that it evaluates to true.
     *
     * @param expr the expression to simplify
     * @return the simplified expression, {@link Constant#FALSE} when unsatisfiable
     */
    public static Expr simplify(Expr expr) {
        Objects.requireNonNull(expr, "expr cannot be null");
        Expr current = expr;
        while (true) {
            Expr next = reduceOnce(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
    }

    private static Expr reduceOnce(Expr expr) {
        Reduction result = new Pass().reduce(expr, true);
        return result.satisfiable() ? result.expr() : Constant.FALSE;
    }

    private record Reduction(boolean satisfiable, Expr expr) {
        static final Reduction UNSATISFIABLE = new Reduction(false, Constant.FALSE);
    }

    private static final class Pass {

        private final Map<Variable, Boolean> forced = new HashMap<>();

        Reduction reduce(Expr expr, boolean constraint) {
            return expr.accept(new Step(constraint));
        }

        private final class Step implements ExprVisitor<Reduction> {

            private final boolean constraint;

            Step(boolean constraint) {
                this.constraint = constraint;
            }

            @Override
            public Reduction visitVariable(Variable variable) {
                Boolean previous = forced.putIfAbsent(variable, constraint);
                if (previous != null && previous != constraint) {
                    return Reduction.UNSATISFIABLE;
                }
                return new Reduction(true, variable);
            }

            @Override
            public Reduction visitConstant(Constant constant) {
                return constant.value() == constraint
                        ? new Reduction(true, constant)
                        : Reduction.UNSATISFIABLE;
            }

            @Override
            public Reduction visitNegation(Negation negation) {
                Reduction operand = reduce(negation.operand(), !constraint);
                if (!operand.satisfiable()) {
                    return Reduction.UNSATISFIABLE;
                }
                if (operand.expr() instanceof Constant folded) {
                    return new Reduction(true, Constant.of(!folded.value()));
                }
                return new Reduction(true, operand.expr() == negation.operand() ? negation : new Negation(operand.expr()));
            }

            @Override
            public Reduction visitImplication(Implication implication) {
                Reduction premise = reduce(implication.premise(), constraint);
                if (!premise.satisfiable()) {
                    return Reduction.UNSATISFIABLE;
                }
                Reduction conclusion = reduce(implication.conclusion(), constraint);
                if (!conclusion.satisfiable()) {
                    return Reduction.UNSATISFIABLE;
                }
                if (premise.expr() == implication.premise() && conclusion.expr() == implication.conclusion()) {
                    return new Reduction(true, implication);
                }
                return new Reduction(true, new Implication(premise.expr(), conclusion.expr()));
            }

            @Override
            public Reduction visitConjunction(Conjunction conjunction) {
                Reduction lhs = reduce(conjunction.lhs(), true);
                if (!lhs.satisfiable()) {
                    return Reduction.UNSATISFIABLE;
                }
                Reduction rhs = reduce(conjunction.rhs(), true);
                if (!rhs.satisfiable()) {
                    return Reduction.UNSATISFIABLE;
                }

                // ⊤ ∧ A → A
                if (Constant.TRUE.equals(lhs.expr())) {
                    return rhs;
                }
                if (Constant.TRUE.equals(rhs.expr())) {
                    return lhs;
                }
                if (lhs.expr() == conjunction.lhs() && rhs.expr() == conjunction.rhs()) {
                    return new Reduction(true, conjunction);
                }
                return new Reduction(true, new Conjunction(lhs.expr(), rhs.expr()));
            }

            @Override
            public Reduction visitDisjunction(Disjunction disjunction) {
                Reduction lhs = reduce(disjunction.lhs(), true);
                Reduction rhs = reduce(disjunction.rhs(), true);
                if (lhs.satisfiable()) {
                    return lhs;
                }
                return rhs.satisfiable() ? rhs : Reduction.UNSATISFIABLE;
            }
        }
    }
}
