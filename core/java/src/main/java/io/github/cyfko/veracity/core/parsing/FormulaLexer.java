package io.github.cyfko.veracity.core.parsing;

import io.github.cyfko.veracity.core.api.Symbol;
import io.github.cyfko.veracity.core.api.Token;
import io.github.cyfko.veracity.core.api.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a formula into {@link Symbol}s.
 * <p>
 * The lexer never fails. Every letter becomes a single-letter {@link Variable}, every
 * reserved glyph becomes its {@link Token}, and every other character is dropped:
 * </p>
 * <pre>{@code
 * FormulaLexer.tokenize("P ∨ ¬Q2");   // [P, ∨, ¬, Q]
 * FormulaLexer.tokenize("PQ");        // [P, Q]
 * FormulaLexer.tokenize("1 + 2");     // []
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaLexer {

    private FormulaLexer() {}

    /**
     * Tokenizes a formula.
     *
     * @param formula the formula text, {@code null} is treated as empty
     * @return the symbols in source order
     */
    public static List<Symbol> tokenize(String formula) {
        if (formula == null || formula.isEmpty()) {
            return List.of();
        }

        List<Symbol> symbols = new ArrayList<>(formula.length());
        int i = 0;
        while (i < formula.length()) {
            int codePoint = formula.codePointAt(i);
            int width = Character.charCount(codePoint);

            if (Character.isLetter(codePoint)) {
                symbols.add(new Variable(formula.substring(i, i + width)));
            } else if (width == 1) {
                Optional<Token> token = Token.fromGlyph(formula.charAt(i));
                token.ifPresent(symbols::add);
            }

            i += width;
        }
        return symbols;
    }
}
