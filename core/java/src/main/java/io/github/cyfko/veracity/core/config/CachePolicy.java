package io.github.cyfko.veracity.core.config;

/**
 * Configuration of the parse cache.
 * <p>
 * Parsed trees are immutable, so a parser can hand out the same {@link
 * io.github.cyfko.veracity.core.api.Expr} for repeated formula text.
 * </p>
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>cacheEnabled</strong>: Keep parsed trees keyed by formula text (default: true)</li>
 *   <li><strong>cacheSize</strong>: Maximum number of cached trees (default: 1000)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CachePolicy.defaults();   // enabled, 1000 entries
 * CachePolicy.strict();     // enabled, 500 entries
 * CachePolicy.relaxed();    // enabled, 2000 entries
 * CachePolicy.none();       // disabled
 * CachePolicy.custom(64);   // enabled, 64 entries
 * }</pre>
 *
 * @param cacheEnabled whether parsed trees are cached
 * @param cacheSize maximum number of cached trees
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the size is not positive, even when caching is disabled
     */
    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    /**
     * Default configuration, paired with {@link FormulaPolicy#defaults()}.
     * <ul>
     *   <li>Cache Enabled: true</li>
     *   <li>Cache Size: 1000 formulas</li>
     * </ul>
     *
     * @return default configuration
     */
    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    /**
     * Configuration sized for {@link FormulaPolicy#strict()}.
     * <p>
     * Strict formulas are capped at 1000 characters, typically typed one at a time, so
     * fewer of them repeat.
     * </p>
     * <ul>
     *   <li>Cache Enabled: true</li>
     *   <li>Cache Size: 500 formulas</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static CachePolicy strict() {
        return new CachePolicy(true, 500);
    }

    /**
     * Configuration sized for {@link FormulaPolicy#relaxed()}.
     * <p>
     * Suitable for generators that re-submit the same large formulas.
     * </p>
     * <ul>
     *   <li>Cache Enabled: true</li>
     *   <li>Cache Size: 2000 formulas</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static CachePolicy relaxed() {
        return new CachePolicy(true, 2000);
    }

    /**
     * Caching completely disabled: every call to
     * {@link io.github.cyfko.veracity.core.api.FormulaParser#parse(String)} builds a new tree.
     * <ul>
     *   <li>Cache Enabled: false</li>
     *   <li>Cache Size: 1 (unused)</li>
     * </ul>
     *
     * @return a CachePolicy with caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    /**
     * Enabled cache holding at most {@code cacheSize} formulas.
     *
     * @param cacheSize the maximum number of cached trees
     * @return a custom configuration
     * @throws IllegalArgumentException if the size is not positive
     */
    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
