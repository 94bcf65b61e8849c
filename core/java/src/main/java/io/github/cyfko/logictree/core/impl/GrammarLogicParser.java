package io.github.cyfko.logictree.core.impl;

import io.github.cyfko.logictree.core.LogicTree;
import io.github.cyfko.logictree.core.api.LogicParser;
import io.github.cyfko.logictree.core.api.Node;
import io.github.cyfko.logictree.core.cache.BoundedLRUCache;
import io.github.cyfko.logictree.core.config.CachePolicy;
import io.github.cyfko.logictree.core.config.ParserPolicy;
import io.github.cyfko.logictree.core.exception.LogicSyntaxException;
import io.github.cyfko.logictree.core.parsing.LogicGrammar;
import io.github.cyfko.logictree.core.parsing.PostfixConverter;
import io.github.cyfko.logictree.core.parsing.PostfixTreeBuilder;
import io.github.cyfko.logictree.core.parsing.Token;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Parser for textual Boolean expressions driven by {@link LogicGrammar#STANDARD}.
 *
 * <h2>Phases</h2>
 * <ol>
 *   <li>{@link PostfixConverter#toPostfix(String, ParserPolicy)}: length limit, tokenizing and
 *       Shunting-Yard conversion with syntax validation</li>
 *   <li>{@link PostfixTreeBuilder#build(List)}: single-pass tree construction</li>
 *   <li>{@link LogicTree#of(Node)}: variable collection, then the variable-count limit</li>
 * </ol>
 *
 * <h2>Caching</h2>
 * <p>
 * With caching enabled (the default) parsed trees are kept in a {@link BoundedLRUCache} keyed
 * by the trimmed expression. Failed parses are never cached.
 * </p>
 *
 * <pre>{@code
 * LogicParser parser = new GrammarLogicParser();
 * LogicTree tree = parser.parse("a * (b + c)");
 *
 * LogicParser strictParser = new GrammarLogicParser(ParserPolicy.strict(), CachePolicy.none());
 * }</pre>
 *
 * <p>Instances are thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class GrammarLogicParser implements LogicParser {

    private static final Logger log = Logger.getLogger(GrammarLogicParser.class.getName());

    private final ParserPolicy parserPolicy;
    private final CachePolicy cachePolicy;
    protected final BoundedLRUCache<String, LogicTree> cache;

    /**
     * Parser with {@link ParserPolicy#unlimited()} and {@link CachePolicy#defaults()}.
     */
    public GrammarLogicParser() {
        this(ParserPolicy.unlimited(), CachePolicy.defaults());
    }

    public GrammarLogicParser(ParserPolicy parserPolicy) {
        this(parserPolicy, CachePolicy.defaults());
    }

    /**
     * @param parserPolicy the limits to enforce
     * @param cachePolicy  the cache settings
     * @throws IllegalArgumentException if a policy is null
     */
    public GrammarLogicParser(ParserPolicy parserPolicy, CachePolicy cachePolicy) {
        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }

        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.parserPolicy = parserPolicy;
        this.cachePolicy = cachePolicy;
        this.cache = cachePolicy.cacheEnabled()
            ? new BoundedLRUCache<>(cachePolicy.cacheSize())
            : null;
    }

    public ParserPolicy getParserPolicy() {
        return parserPolicy;
    }

    /**
     * Clears the parser cache (if enabled).
     */
    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * @return cache statistics, or {@code {enabled=false}} when caching is disabled
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

    @Override
    public LogicTree parse(String expression) throws LogicSyntaxException {
        if (expression == null || expression.isBlank()) {
            throw new LogicSyntaxException("Logic expression cannot be null or empty");
        }

        String key = expression.trim();
        if (cache == null) {
            return doParse(key);
        }

        LogicTree cached = cache.get(key);
        if (cached != null) {
            log.fine(() -> String.format("Cache hit for expression '%s'", key));
            return cached;
        }

        LogicTree tree = doParse(key);
        cache.put(key, tree);
        return tree;
    }

    private LogicTree doParse(String expression) {
        List<Token> postfix = PostfixConverter.toPostfix(expression, parserPolicy);
        Node root = PostfixTreeBuilder.build(postfix);
        LogicTree tree = LogicTree.of(root);

        if (tree.variables().size() > parserPolicy.maxVariables()) {
            throw new LogicSyntaxException(String.format(
                    "Too many variables (%d, max: %d). Policy applied: %s",
                    tree.variables().size(), parserPolicy.maxVariables(), parserPolicy.policyName()
            ));
        }

        log.fine(() -> String.format("Parsed '%s' into %s over %s", expression, tree.toFunctional(), tree.variables()));
        return tree;
    }
}
