package io.github.cyfko.veracity.core.impl;

import io.github.cyfko.veracity.core.api.Expr;
import io.github.cyfko.veracity.core.api.FormulaParser;
import io.github.cyfko.veracity.core.api.Symbol;
import io.github.cyfko.veracity.core.cache.BoundedLRUCache;
import io.github.cyfko.veracity.core.config.CachePolicy;
import io.github.cyfko.veracity.core.config.FormulaPolicy;
import io.github.cyfko.veracity.core.exception.FormulaSyntaxException;
import io.github.cyfko.veracity.core.parsing.FormulaLexer;
import io.github.cyfko.veracity.core.parsing.ShuntingYardTreeBuilder;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Default {@link FormulaParser}: length check, {@link FormulaLexer}, then
 * {@link ShuntingYardTreeBuilder}.
 *
 * <h2>Caching</h2>
 * <p>
 * Parsed trees are immutable, so the parser keeps an optional LRU cache keyed by the raw
 * formula text ({@link CachePolicy}). Formulas that parse to nothing are not cached.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Permissive, cached
 * FormulaParser parser = new BasicFormulaParser();
 * Optional<Expr> tree = parser.parse("¬(P ∧ Q) ∨ R");
 *
 * // Reject malformed structure, no cache
 * FormulaParser strict = new BasicFormulaParser(FormulaPolicy.strict(), CachePolicy.none());
 * strict.parse("(P ∧ Q");   // FormulaSyntaxException
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicFormulaParser implements FormulaParser {

    private static final Logger log = Logger.getLogger(BasicFormulaParser.class.getName());

    private final FormulaPolicy formulaPolicy;
    private final CachePolicy cachePolicy;
    protected final BoundedLRUCache<String, Expr> cache;

    public BasicFormulaParser() {
        this(FormulaPolicy.defaults(), CachePolicy.defaults());
    }

    public BasicFormulaParser(FormulaPolicy formulaPolicy) {
        this(formulaPolicy, CachePolicy.defaults());
    }

    /**
     * @param formulaPolicy length limit and malformed-input handling
     * @param cachePolicy the cache policy settings
     * @throws IllegalArgumentException if either policy is null
     */
    public BasicFormulaParser(FormulaPolicy formulaPolicy, CachePolicy cachePolicy) {
        if (formulaPolicy == null) {
            throw new IllegalArgumentException("Formula policy is required");
        }
        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.formulaPolicy = formulaPolicy;
        this.cachePolicy = cachePolicy;
        this.cache = cachePolicy.cacheEnabled()
            ? new BoundedLRUCache<>(cachePolicy.cacheSize())
            : null;
    }

    public FormulaPolicy getFormulaPolicy() {
        return formulaPolicy;
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * Returns cache statistics (if caching is enabled).
     *
     * @return map containing cache statistics, or only {@code enabled=false} when disabled
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }

        return Map.of(
            "enabled", true,
            "size", cache.size(),
            "maxSize", cachePolicy.cacheSize(),
            "hits", cache.getHits(),
            "misses", cache.getMisses()
        );
    }

    /**
     * {@inheritDoc}
     *
     * @throws FormulaSyntaxException if the formula is longer than
     *                                {@link FormulaPolicy#maxFormulaLength()}, or malformed
     *                                under {@link FormulaPolicy#strictSyntax()}
     */
    @Override
    public Optional<Expr> parse(String formula) throws FormulaSyntaxException {
        if (formula == null || formula.isBlank()) {
            return Optional.empty();
        }

        if (formula.length() > formulaPolicy.maxFormulaLength()) {
            throw new FormulaSyntaxException(String.format(
                    "Formula too long (%d characters, max: %d). Policy applied: %s",
                    formula.length(), formulaPolicy.maxFormulaLength(), formulaPolicy.policyName()
            ));
        }

        if (cache == null) {
            return parseUncached(formula);
        }
        return Optional.ofNullable(cache.computeIfAbsent(formula, text -> parseUncached(text).orElse(null)));
    }

    private Optional<Expr> parseUncached(String formula) {
        List<Symbol> symbols = FormulaLexer.tokenize(formula);
        log.fine(() -> String.format("Tokenized formula into %d symbol(s): %s", symbols.size(), symbols));
        return ShuntingYardTreeBuilder.build(symbols, formulaPolicy);
    }
}
