package io.github.cyfko.veracity.core.exception;

import io.github.cyfko.veracity.core.api.FormulaParser;
import io.github.cyfko.veracity.core.config.FormulaPolicy;

/**
 * Exception thrown when a formula cannot be accepted by a {@link FormulaParser}.
 * <p>
 * The default policy is permissive: unknown characters are dropped and malformed structure
 * is repaired silently, so in that mode this exception only reports a formula exceeding
 * {@link FormulaPolicy#maxFormulaLength()}. With {@link FormulaPolicy#strictSyntax()}
 * enabled, structural problems are reported as well.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * // Any policy
 * parser.parse("P∧".repeat(3000));
 * // → "Formula too long (6000 characters, max: 5000). Policy applied: DEFAULT_POLICY"
 *
 * // Strict policy only
 * parser.parse("(P∧Q");
 * // → "Mismatched parentheses: unmatched '('"
 *
 * parser.parse("P∧");
 * // → "Operator '∧' requires 2 operand(s), found 1"
 *
 * parser.parse("P Q");
 * // → "Malformed formula: 2 operands left without an operator (expected 1)"
 * }</pre>
 *
 * <p>
 * Unsatisfiable formulas are not an error: they simplify to {@code Constant(false)} and
 * solve to an empty solution list.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see FormulaParser
 * @see FormulaPolicy
 */
public class FormulaSyntaxException extends RuntimeException {

    /**
     * @param message the message describing the rejected formula
     */
    public FormulaSyntaxException(String message) {
        super(message);
    }

    /**
     * @param message the message describing the rejected formula
     * @param cause   the underlying cause
     */
    public FormulaSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
