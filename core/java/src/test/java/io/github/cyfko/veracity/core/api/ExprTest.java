package io.github.cyfko.veracity.core.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Expression Model Tests")
class ExprTest {

    @Nested
    @DisplayName("Variable")
    class VariableTests {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {" ", "\t"})
        @DisplayName("Should reject a missing identifier")
        void testInvalidIdentifier(String identifier) {
            assertThrows(IllegalArgumentException.class, () -> new Variable(identifier));
        }

        @Test
        @DisplayName("Should compare by identifier")
        void testEquality() {
            assertEquals(new Variable("P"), new Variable("P"));
            assertNotEquals(new Variable("P"), new Variable("Q"));
            assertEquals("P", new Variable("P").toString());
        }
    }

    @Nested
    @DisplayName("Compound nodes")
    class CompoundTests {

        private final Variable p = new Variable("P");

        @Test
        @DisplayName("Should reject null children")
        void testNullChildren() {
            assertThrows(NullPointerException.class, () -> new Negation(null));
            assertThrows(NullPointerException.class, () -> new Conjunction(p, null));
            assertThrows(NullPointerException.class, () -> new Disjunction(null, p));
            assertThrows(NullPointerException.class, () -> new Implication(p, null));
        }

        @Test
        @DisplayName("Should compare structurally")
        void testStructuralEquality() {
            assertEquals(new Conjunction(p, new Negation(p)), new Conjunction(new Variable("P"), new Negation(new Variable("P"))));
            assertNotEquals(new Conjunction(p, new Variable("Q")), new Conjunction(new Variable("Q"), p));
            assertNotEquals(new Conjunction(p, p), new Disjunction(p, p));
        }

        @Test
        @DisplayName("Should dispatch to the matching visitor method")
        void testVisitorDispatch() {
            ExprVisitor<String> names = new ExprVisitor<>() {
                @Override public String visitVariable(Variable variable) { return "variable"; }
                @Override public String visitNegation(Negation negation) { return "negation"; }
                @Override public String visitConjunction(Conjunction conjunction) { return "conjunction"; }
                @Override public String visitDisjunction(Disjunction disjunction) { return "disjunction"; }
                @Override public String visitImplication(Implication implication) { return "implication"; }
                @Override public String visitConstant(Constant constant) { return "constant"; }
            };

            assertEquals("variable", p.accept(names));
            assertEquals("negation", new Negation(p).accept(names));
            assertEquals("conjunction", new Conjunction(p, p).accept(names));
            assertEquals("disjunction", new Disjunction(p, p).accept(names));
            assertEquals("implication", new Implication(p, p).accept(names));
            assertEquals("constant", Constant.TRUE.accept(names));
        }
    }

    @Nested
    @DisplayName("Constant")
    class ConstantTests {

        @Test
        @DisplayName("Should map booleans to the shared constants")
        void testOf() {
            assertSame(Constant.TRUE, Constant.of(true));
            assertSame(Constant.FALSE, Constant.of(false));
            assertTrue(Constant.TRUE.value());
        }
    }

    @Nested
    @DisplayName("Token")
    class TokenTests {

        @ParameterizedTest
        @EnumSource(Token.class)
        @DisplayName("Should resolve every token from its glyph")
        void testFromGlyph(Token token) {
            assertEquals(Optional.of(token), Token.fromGlyph(token.glyph()));
            assertEquals(String.valueOf(token.glyph()), token.toString());
        }

        @Test
        @DisplayName("Should not resolve unreserved characters")
        void testUnknownGlyph() {
            assertTrue(Token.fromGlyph('&').isEmpty());
            assertTrue(Token.fromGlyph('⊤').isEmpty());
        }

        @Test
        @DisplayName("Should flag only parentheses")
        void testIsParenthesis() {
            assertTrue(Token.LEFT_PAREN.isParenthesis());
            assertTrue(Token.RIGHT_PAREN.isParenthesis());
            assertFalse(Token.NEGATION.isParenthesis());
        }
    }
}
