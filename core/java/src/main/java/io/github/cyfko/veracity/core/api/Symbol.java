package io.github.cyfko.veracity.core.api;

/**
 * A lexical unit emitted by the formula lexer: either a reserved {@link Token} or a
 * {@link Variable}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Symbol permits Token, Variable {
}
