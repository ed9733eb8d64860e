package io.github.cyfko.veracity.core;

import io.github.cyfko.veracity.core.api.Assignment;
import io.github.cyfko.veracity.core.api.Constant;
import io.github.cyfko.veracity.core.api.Expr;
import io.github.cyfko.veracity.core.api.FormulaParser;
import io.github.cyfko.veracity.core.config.FormulaPolicy;
import io.github.cyfko.veracity.core.exception.FormulaSyntaxException;
import io.github.cyfko.veracity.core.impl.BasicFormulaParser;
import io.github.cyfko.veracity.core.parsing.ConstantFoldingSimplifier;
import io.github.cyfko.veracity.core.parsing.ExprFormatter;
import io.github.cyfko.veracity.core.solver.ConstraintSolver;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * High-level facade over the parse, simplify and solve pipeline.
 *
 * <p><strong>Architecture Overview:</strong></p>
 * <ol>
 *   <li><strong>Parse:</strong> text to {@link Expr} through a {@link FormulaParser}</li>
 *   <li><strong>Simplify:</strong> optional constant folding with {@link ConstantFoldingSimplifier}</li>
 *   <li><strong>Solve:</strong> enumerate satisfying {@link Assignment}s with {@link ConstraintSolver}</li>
 * </ol>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * Veracity veracity = Veracity.of();
 *
 * veracity.solve("P∨Q");                    // [{Q=true}, {P=true}]
 * veracity.solve("¬V∧W");                   // [{W=true, V=false}]
 *
 * Expr tree = veracity.parse("(P∧¬P)∨Q").orElseThrow();
 * veracity.simplify(tree);                  // Variable(Q)
 * veracity.stringify(tree);                 // "((P ∧ (¬P)) ∨ Q)"
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link FormulaSyntaxException} - formula too long, or malformed under a strict policy</li>
 *   <li>An unsatisfiable formula is not an error: it solves to an empty list</li>
 * </ul>
 *
 * <p>
 * Instances are immutable and thread-safe as long as the supplied parser is.
 * </p>
 *
 * @see FormulaParser
 * @see FormulaPolicy
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Veracity {

    private static final Logger log = Logger.getLogger(Veracity.class.getName());

    private final FormulaParser parser;
    private final FormulaPolicy policy;

    private Veracity(FormulaParser parser, FormulaPolicy policy) {
        this.parser = Objects.requireNonNull(parser, "Formula parser cannot be null");
        this.policy = Objects.requireNonNull(policy, "Formula policy cannot be null");
    }

    /**
     * Creates a facade with the default {@link BasicFormulaParser} and
     * {@link FormulaPolicy#defaults()}.
     *
     * @return a new facade
     */
    public static Veracity of() {
        return of(FormulaPolicy.defaults());
    }

    /**
     * Creates a facade whose default parser and solve step both follow {@code policy}.
     *
     * @param policy the policy to apply
     * @return a new facade
     */
    public static Veracity of(FormulaPolicy policy) {
        return new Veracity(new BasicFormulaParser(policy), policy);
    }

    /**
     * Creates a facade over a custom parser.
     *
     * @param parser the parser turning text into trees
     * @param policy the policy applied when solving, see {@link FormulaPolicy#simplifyBeforeSolve()}
     * @return a new facade
     * @throws NullPointerException if any argument is null
     */
    public static Veracity of(FormulaParser parser, FormulaPolicy policy) {
        return new Veracity(parser, policy);
    }

    /**
     * Parses a formula.
     *
     * @param formula the formula text
     * @return the tree, or empty if the formula contains no variable
     */
    public Optional<Expr> parse(String formula) {
        return parser.parse(formula);
    }

    /**
     * Simplifies a tree under the requirement that it evaluates to true.
     *
     * @param expr the tree to simplify
     * @return the simplified tree, {@link Constant#FALSE} if unsatisfiable
     */
    public Expr simplify(Expr expr) {
        Expr simplified = ConstantFoldingSimplifier.simplify(expr);
        log.fine(() -> String.format("Simplified %s to %s",
                ExprFormatter.stringify(expr), ExprFormatter.stringify(simplified)));
        return simplified;
    }

    /**
     * Parses a formula and finds the assignments making it true.
     * <p>
     * When the policy enables {@link FormulaPolicy#simplifyBeforeSolve()}, the simplified
     * tree is solved instead of the parsed one.
     * </p>
     *
     * @param formula the formula text
     * @return the satisfying partial assignments, empty if the formula parses to nothing
     */
    public List<Assignment> solve(String formula) {
        Optional<Expr> parsed = parser.parse(formula);
        if (parsed.isEmpty()) {
            log.fine(() -> "Nothing to solve in formula '" + formula + "'");
            return List.of();
        }

        Expr expr = parsed.get();
        if (policy.simplifyBeforeSolve()) {
            expr = simplify(expr);
        }
        return solveExpr(expr);
    }

    /**
     * Finds the assignments making an already parsed tree true.
     *
     * @param expr the tree to solve
     * @return the satisfying partial assignments
     */
    public List<Assignment> solveExpr(Expr expr) {
        return solveFor(expr, true);
    }

    /**
     * Finds the assignments forcing a tree to the given truth value.
     *
     * @param expr the tree to solve
     * @param constraint the required truth value
     * @return the partial assignments, in search order
     */
    public List<Assignment> solveFor(Expr expr, boolean constraint) {
        long start = System.nanoTime();
        List<Assignment> solutions = ConstraintSolver.solveFor(expr, constraint);
        long durationMicros = (System.nanoTime() - start) / 1_000;

        log.fine(() -> String.format(
                "Solved %s for %s: %d assignment(s) in %d µs",
                ExprFormatter.stringify(expr), constraint, solutions.size(), durationMicros
        ));
        return solutions;
    }

    /**
     * Renders a tree as a fully parenthesised formula.
     *
     * @param expr the tree to render
     * @return the formula text
     */
    public String stringify(Expr expr) {
        return ExprFormatter.stringify(expr);
    }

    public FormulaPolicy getPolicy() {
        return policy;
    }
}
