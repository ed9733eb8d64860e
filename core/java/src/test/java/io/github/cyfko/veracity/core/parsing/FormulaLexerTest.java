package io.github.cyfko.veracity.core.parsing;

import io.github.cyfko.veracity.core.api.Symbol;
import io.github.cyfko.veracity.core.api.Token;
import io.github.cyfko.veracity.core.api.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaLexer Tests")
class FormulaLexerTest {

    @Test
    @DisplayName("Should map every reserved glyph to its token")
    void testReservedGlyphs() {
        List<Symbol> symbols = FormulaLexer.tokenize("∧∨→¬()");

        assertEquals(List.of(
                Token.CONJUNCTION, Token.DISJUNCTION, Token.IMPLICATION,
                Token.NEGATION, Token.LEFT_PAREN, Token.RIGHT_PAREN
        ), symbols);
    }

    @Test
    @DisplayName("Should turn each letter into its own variable")
    void testAdjacentLettersAreSeparateVariables() {
        assertEquals(List.of(new Variable("P"), new Variable("Q")), FormulaLexer.tokenize("PQ"));
    }

    @Test
    @DisplayName("Should drop whitespace, digits and unknown symbols")
    void testIgnoredCharacters() {
        // Given
        String formula = "P ∨ ¬Q2 & ⊤";

        // When
        List<Symbol> symbols = FormulaLexer.tokenize(formula);

        // Then
        assertEquals(List.of(new Variable("P"), Token.DISJUNCTION, Token.NEGATION, new Variable("Q")), symbols);
    }

    @Test
    @DisplayName("Should accept non-ASCII letters, including supplementary code points")
    void testUnicodeLetters() {
        List<Symbol> symbols = FormulaLexer.tokenize("é∧𝐀");

        assertEquals(3, symbols.size());
        assertEquals(new Variable("é"), symbols.get(0));
        assertEquals(Token.CONJUNCTION, symbols.get(1));
        assertEquals(new Variable("𝐀"), symbols.get(2));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "123", "+-*/", "⊤⊥"})
    @DisplayName("Should yield no symbol for input without letters or glyphs")
    void testNothingToTokenize(String formula) {
        assertTrue(FormulaLexer.tokenize(formula).isEmpty());
    }

    @Test
    @DisplayName("Should treat null as empty input")
    void testNullInput() {
        assertEquals(List.of(), FormulaLexer.tokenize(null));
    }
}
