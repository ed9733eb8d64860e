package io.github.cyfko.veracity.core.parsing;

import io.github.cyfko.veracity.core.api.Conjunction;
import io.github.cyfko.veracity.core.api.Disjunction;
import io.github.cyfko.veracity.core.api.Expr;
import io.github.cyfko.veracity.core.api.Implication;
import io.github.cyfko.veracity.core.api.Negation;
import io.github.cyfko.veracity.core.api.Symbol;
import io.github.cyfko.veracity.core.api.Token;
import io.github.cyfko.veracity.core.api.Variable;
import io.github.cyfko.veracity.core.config.FormulaPolicy;
import io.github.cyfko.veracity.core.exception.FormulaSyntaxException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds an {@link Expr} tree from lexer output in a single pass, using the shunting-yard
 * algorithm with an operand stack and an operator stack.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * For each symbol:
 *   - VARIABLE: push to operands
 *   - '(':      push to operators
 *   - ')':      reduce operators until '(' then discard it
 *   - OPERATOR: while top is not '(' and binds strictly tighter, reduce it; push operator
 * At the end, reduce every remaining operator.
 *
 * Reduce '¬':      pop a           → Negation(a)
 * Reduce '∧', '∨': pop a, pop b    → node(lhs = a, rhs = b)
 * Reduce '→':      pop a, pop b    → Implication(premise = b, conclusion = a)
 * </pre>
 *
 * <p>
 * Equal precedence never reduces ahead of time, so chains of the same operator are grouped
 * from the right: {@code P∧Q∧R} is {@code P∧(Q∧R)} and {@code P→Q→R} is {@code P→(Q→R)}.
 * </p>
 *
 * <h2>Malformed Input</h2>
 * <p>
 * With a lenient {@link FormulaPolicy} the builder repairs what it can: an operator missing
 * operands is dropped, an unmatched parenthesis is ignored, and when several operands are
 * left over the most recently built one is the result. With
 * {@link FormulaPolicy#strictSyntax()} each of those raises a {@link FormulaSyntaxException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see FormulaLexer
 */
public final class ShuntingYardTreeBuilder {

    private static final Map<Token, Integer> PRECEDENCE = Map.of(
            Token.NEGATION, 40,
            Token.CONJUNCTION, 30,
            Token.DISJUNCTION, 20,
            Token.IMPLICATION, 10
    );

    private ShuntingYardTreeBuilder() {}

    /**
     * Builds the expression tree for a symbol sequence.
     *
     * @param symbols lexer output, in source order
     * @param policy the policy deciding how malformed input is handled
     * @return the root of the tree, or empty if there was no operand at all
     * @throws FormulaSyntaxException if the input is malformed and the policy is strict
     */
    public static Optional<Expr> build(List<Symbol> symbols, FormulaPolicy policy) {
        Objects.requireNonNull(symbols, "symbols cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");

        boolean strict = policy.strictSyntax();
        Deque<Expr> operands = new ArrayDeque<>();
        Deque<Token> operators = new ArrayDeque<>();

        for (Symbol symbol : symbols) {
            if (symbol instanceof Variable variable) {
                operands.push(variable);
                continue;
            }

            Token token = (Token) symbol;
            switch (token) {
                case LEFT_PAREN -> operators.push(token);

                case RIGHT_PAREN -> {
                    while (!operators.isEmpty() && operators.peek() != Token.LEFT_PAREN) {
                        reduce(operators.pop(), operands, strict);
                    }
                    if (operators.isEmpty()) {
                        if (strict) {
                            throw new FormulaSyntaxException("Mismatched parentheses: unmatched ')'");
                        }
                    } else {
                        operators.pop();
                    }
                }

                default -> {
                    while (!operators.isEmpty()
                            && !operators.peek().isParenthesis()
                            && PRECEDENCE.get(operators.peek()) > PRECEDENCE.get(token)) {
                        reduce(operators.pop(), operands, strict);
                    }
                    operators.push(token);
                }
            }
        }

        while (!operators.isEmpty()) {
            Token top = operators.pop();
            if (top == Token.LEFT_PAREN) {
                if (strict) {
                    throw new FormulaSyntaxException("Mismatched parentheses: unmatched '('");
                }
                continue;
            }
            reduce(top, operands, strict);
        }

        if (strict && operands.size() > 1) {
            throw new FormulaSyntaxException(String.format(
                    "Malformed formula: %d operands left without an operator (expected 1)",
                    operands.size()
            ));
        }

        return Optional.ofNullable(operands.peek());
    }

    private static void reduce(Token operator, Deque<Expr> operands, boolean strict) {
        int arity = operator == Token.NEGATION ? 1 : 2;
        if (operands.size() < arity) {
            if (strict) {
                throw new FormulaSyntaxException(String.format(
                        "Operator '%s' requires %d operand(s), found %d",
                        operator, arity, operands.size()
                ));
            }
            return;
        }

        Expr a = operands.pop();
        switch (operator) {
            case NEGATION -> operands.push(new Negation(a));
            case CONJUNCTION -> operands.push(new Conjunction(a, operands.pop()));
            case DISJUNCTION -> operands.push(new Disjunction(a, operands.pop()));
            case IMPLICATION -> operands.push(new Implication(operands.pop(), a));
            default -> throw new IllegalStateException("Not an operator: " + operator);
        }
    }
}
