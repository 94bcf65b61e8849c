package io.github.cyfko.logictree.core.config;

/**
 * Caching of parsed trees, keyed by trimmed expression text.
 * <p>
 * Parsed trees are immutable, so a cached tree is handed out to every caller that parses the
 * same text.
 * </p>
 *
 * <pre>{@code
 * CachePolicy.defaults();   // 1000 entries
 * CachePolicy.strict();     // 500 entries
 * CachePolicy.relaxed();    // 2000 entries
 * CachePolicy.none();       // no cache
 * CachePolicy.custom(64);
 * }</pre>
 *
 * @param cacheEnabled whether parsed trees are cached
 * @param cacheSize    maximum number of cached trees
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    public static CachePolicy strict() {
        return new CachePolicy(true, 500);
    }

    public static CachePolicy relaxed() {
        return new CachePolicy(true, 2000);
    }

    /**
     * @return a policy with caching disabled (size 1, unused)
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
