package io.github.cyfko.veracity.core.solver;

import io.github.cyfko.veracity.core.api.Assignment;
import io.github.cyfko.veracity.core.api.Conjunction;
import io.github.cyfko.veracity.core.api.Constant;
import io.github.cyfko.veracity.core.api.Disjunction;
import io.github.cyfko.veracity.core.api.Expr;
import io.github.cyfko.veracity.core.api.ExprVisitor;
import io.github.cyfko.veracity.core.api.Implication;
import io.github.cyfko.veracity.core.api.Negation;
import io.github.cyfko.veracity.core.api.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Enumerates partial assignments that force an expression to a required truth value.
 *
 * <h2>Algorithm</h2>
 * <p>
 * The solver pushes the required value (the <em>constraint</em>) down the tree, starting
 * from a single empty {@link Assignment}, and keeps every assignment that survives:
 * </p>
 * <pre>
 * Variable v:     drop the assignment if v is bound to the other value, else bind v
 * Constant c:     keep the assignment iff c equals the constraint
 * Negation x:     solve x for the opposite constraint
 * Conjunction:    solve lhs, then solve rhs on every survivor
 * Disjunction:    solve lhs and rhs independently from the same assignment, keep both
 * Implication:    required false → premise true, then conclusion false
 *                 required true  → assignment kept as is
 * </pre>
 *
 * <p>
 * Each disjunction can double the number of assignments, so the result grows as
 * {@code 2^k} for {@code k} disjunctions on the search path. Assignments are persistent, so
 * both branches of a disjunction start from the same instance without copying it.
 * </p>
 *
 * <h2>Known Limitations</h2>
 * <ul>
 *   <li>A conjunction required false is not expanded with de Morgan's laws: both sides are
 *       required false.</li>
 *   <li>An implication required true is accepted without inspecting its premise or
 *       conclusion, which may leave a solution under-constrained.</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * <p>
 * Traversal is left to right over the stored operands, {@code lhs} branch first. Since the
 * parser stores the textually last operand as {@code lhs}, {@code P∨Q} solves to
 * {@code [{Q=true}, {P=true}]}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ConstraintSolver {

    private ConstraintSolver() {}

    /**
     * Finds the assignments forcing {@code expr} to {@code constraint}.
     *
     * @param expr the expression to solve
     * @param constraint the required truth value
     * @return the surviving assignments, in search order; empty if none
     */
    public static List<Assignment> solveFor(Expr expr, boolean constraint) {
        Objects.requireNonNull(expr, "expr cannot be null");
        return solve(expr, List.of(Assignment.empty()), constraint);
    }

    private static List<Assignment> solve(Expr expr, List<Assignment> assignments, boolean constraint) {
        List<Assignment> survivors = new ArrayList<>();
        for (Assignment assignment : assignments) {
            survivors.addAll(expr.accept(new Branch(assignment, constraint)));
        }
        return survivors;
    }

    /**
     * Solves one node for one incoming assignment.
     */
    private static final class Branch implements ExprVisitor<List<Assignment>> {

        private final Assignment assignment;
        private final boolean constraint;

        Branch(Assignment assignment, boolean constraint) {
            this.assignment = assignment;
            this.constraint = constraint;
        }

        @Override
        public List<Assignment> visitVariable(Variable variable) {
            Optional<Boolean> bound = assignment.get(variable);
            if (bound.isPresent() && bound.get() != constraint) {
                return List.of();
            }
            return List.of(assignment.bind(variable, constraint));
        }

        @Override
        public List<Assignment> visitConstant(Constant constant) {
            return constant.value() == constraint ? List.of(assignment) : List.of();
        }

        @Override
        public List<Assignment> visitNegation(Negation negation) {
            return solve(negation.operand(), List.of(assignment), !constraint);
        }

        @Override
        public List<Assignment> visitConjunction(Conjunction conjunction) {
            List<Assignment> left = solve(conjunction.lhs(), List.of(assignment), constraint);
            return solve(conjunction.rhs(), left, constraint);
        }

        @Override
        public List<Assignment> visitDisjunction(Disjunction disjunction) {
            List<Assignment> result = new ArrayList<>(solve(disjunction.lhs(), List.of(assignment), constraint));
            result.addAll(solve(disjunction.rhs(), List.of(assignment), constraint));
            return result;
        }

        @Override
        public List<Assignment> visitImplication(Implication implication) {
            if (constraint) {
                // TODO: validate premise/conclusion once callers opt into classical implication semantics
                return List.of(assignment);
            }
            List<Assignment> premiseHolds = solve(implication.premise(), List.of(assignment), true);
            return solve(implication.conclusion(), premiseHolds, false);
        }
    }
}
