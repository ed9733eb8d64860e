package io.github.cyfko.veracity.core.api;

import io.github.cyfko.veracity.core.exception.FormulaSyntaxException;

import java.util.Optional;

/**
 * Parser contract turning propositional-logic formulas into {@link Expr} trees.
 *
 * <h2>Formula Language</h2>
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Glyph</th><th>Precedence</th><th>Associativity</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>Highest</td><td>N/A</td><td>(P ∨ Q) ∧ R</td></tr>
 * <tr><td>NOT</td><td>¬</td><td>40</td><td>Right</td><td>¬P</td></tr>
 * <tr><td>AND</td><td>∧</td><td>30</td><td>Right</td><td>P ∧ Q</td></tr>
 * <tr><td>OR</td><td>∨</td><td>20</td><td>Right</td><td>P ∨ Q</td></tr>
 * <tr><td>IMPLIES</td><td>→</td><td>10</td><td>Right</td><td>P → Q</td></tr>
 * </tbody>
 * </table>
 *
 * <p>
 * Every letter is a variable of its own: {@code PQ} is two variables, not one. Characters
 * that are neither letters nor reserved glyphs (whitespace, digits, punctuation) are
 * ignored, so {@code "P ∨ ¬ Q"} and {@code "P∨¬Q"} parse to the same tree.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * FormulaParser parser = new BasicFormulaParser();
 *
 * parser.parse("P∧Q");            // Conjunction(lhs=Q, rhs=P)
 * parser.parse("¬P ∨ Q → R");     // Implication(premise=Disjunction(lhs=Q, rhs=¬P), conclusion=R)
 * parser.parse("1 + 2");          // Optional.empty(), nothing left to parse
 * }</pre>
 *
 * @see Expr
 * @see FormulaSyntaxException
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FormulaParser {

    /**
     * Parses a formula into an expression tree.
     *
     * @param formula the formula text, {@code null} is treated as empty
     * @return the parsed tree, or empty when the formula holds no variable
     * @throws FormulaSyntaxException if the formula exceeds the configured length, or is
     *                                malformed while strict syntax is enabled
     */
    Optional<Expr> parse(String formula) throws FormulaSyntaxException;
}
