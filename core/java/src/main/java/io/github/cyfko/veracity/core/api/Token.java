package io.github.cyfko.veracity.core.api;

import java.util.Optional;

/**
 * Reserved glyphs of the formula language.
 * <p>
 * Each constant is bound to exactly one unicode glyph. Any character that is neither a
 * letter nor one of these glyphs is ignored by the lexer.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Token implements Symbol {
    CONJUNCTION('∧'),
    DISJUNCTION('∨'),
    IMPLICATION('→'),
    NEGATION('¬'),
    LEFT_PAREN('('),
    RIGHT_PAREN(')');

    private final char glyph;

    Token(char glyph) {
        this.glyph = glyph;
    }

    public char glyph() {
        return glyph;
    }

    /**
     * Whether this token is one of the two parentheses.
     *
     * @return {@code true} for {@link #LEFT_PAREN} and {@link #RIGHT_PAREN}
     */
    public boolean isParenthesis() {
        return this == LEFT_PAREN || this == RIGHT_PAREN;
    }

    /**
     * Looks up the token bound to a glyph.
     *
     * @param glyph the character to look up
     * @return the matching token, or empty if the character is not reserved
     */
    public static Optional<Token> fromGlyph(char glyph) {
        for (Token token : values()) {
            if (token.glyph == glyph) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return String.valueOf(glyph);
    }
}
