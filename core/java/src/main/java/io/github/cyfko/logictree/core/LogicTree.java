package io.github.cyfko.logictree.core;

import io.github.cyfko.logictree.core.api.Leaf;
import io.github.cyfko.logictree.core.api.LogicParser;
import io.github.cyfko.logictree.core.api.Node;
import io.github.cyfko.logictree.core.api.NodeVisitor;
import io.github.cyfko.logictree.core.api.Operation;
import io.github.cyfko.logictree.core.api.SimplifyMode;
import io.github.cyfko.logictree.core.config.CachePolicy;
import io.github.cyfko.logictree.core.config.ParserPolicy;
import io.github.cyfko.logictree.core.eval.Evaluator;
import io.github.cyfko.logictree.core.exception.LogicSyntaxException;
import io.github.cyfko.logictree.core.format.JsonInterchange;
import io.github.cyfko.logictree.core.impl.GrammarLogicParser;
import io.github.cyfko.logictree.core.spi.Minimizer;
import io.github.cyfko.logictree.core.table.TruthTable;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A Boolean expression together with its sorted variable list.
 * <p>
 * This is the main entry point of the library. A tree is built once, by parsing text or by
 * decoding an interchange form, and never changes afterwards. Its variables are every leaf
 * name, deduplicated and sorted ascending.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * LogicTree tree = LogicTree.parse("a and b or a and c");
 *
 * tree.variables();                         // [a, b, c]
 * tree.toDisplay();                         // "a AND b OR a AND c"
 * tree.evaluate(Map.of("a", true, "b", false, "c", true)); // true
 *
 * System.out.println(tree.truthTable().format());
 *
 * String simplest = tree.simplify(minimizer);            // shorter of minterm / maxterm form
 * String sop = tree.simplify(minimizer, SimplifyMode.MINTERM);
 *
 * LogicTree copy = LogicTree.fromInterchange(tree.toInterchange());
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LogicTree {

    private static final LogicParser DEFAULT_PARSER = new GrammarLogicParser();

    private final Node root;
    private final List<String> variables;

    private LogicTree(Node root) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        this.variables = collectVariables(root);
    }

    /**
     * Parses text with the shared default parser.
     *
     * @param expression the text to parse
     * @return the parsed tree
     * @throws LogicSyntaxException if the text is not a valid expression
     */
    public static LogicTree parse(String expression) {
        return DEFAULT_PARSER.parse(expression);
    }

    /**
     * @param expression the text to parse
     * @param parser     the parser to use
     * @return the parsed tree
     * @throws LogicSyntaxException if the text is not a valid expression
     */
    public static LogicTree parse(String expression, LogicParser parser) {
        return Objects.requireNonNull(parser, "parser cannot be null").parse(expression);
    }

    /**
     * Creates a parser that enforces the given limits.
     *
     * <pre>{@code
     * LogicParser parser = LogicTree.parser(ParserPolicy.strict(), CachePolicy.none());
     * LogicTree tree = LogicTree.parse(userInput, parser);
     * }</pre>
     *
     * @param parserPolicy the limits to enforce
     * @param cachePolicy  the parse-cache settings
     * @return a new thread-safe parser
     * @throws IllegalArgumentException if a policy is null
     */
    public static LogicParser parser(ParserPolicy parserPolicy, CachePolicy cachePolicy) {
        return new GrammarLogicParser(parserPolicy, cachePolicy);
    }

    /**
     * Wraps an already built node.
     *
     * @param root the expression root
     * @return the tree
     */
    public static LogicTree of(Node root) {
        return new LogicTree(root);
    }

    /**
     * @param interchange nested-map form of the root node
     * @return the decoded tree
     * @throws io.github.cyfko.logictree.core.exception.MalformedInterchangeException if the map is not a valid node
     */
    public static LogicTree fromInterchange(Map<String, ?> interchange) {
        return new LogicTree(Node.fromInterchange(interchange));
    }

    /**
     * @param json JSON text of the interchange form
     * @return the decoded tree
     * @throws io.github.cyfko.logictree.core.exception.MalformedInterchangeException if the text is not a valid node
     */
    public static LogicTree fromJson(String json) {
        return new LogicTree(JsonInterchange.fromJson(json));
    }

    public Node root() {
        return root;
    }

    /**
     * @return distinct variable names in ascending order, unmodifiable
     */
    public List<String> variables() {
        return variables;
    }

    /**
     * @param assignment a truth value for every variable
     * @return the value of the expression
     * @throws io.github.cyfko.logictree.core.exception.UnboundVariableException if a variable is missing
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        return Evaluator.evaluate(root, assignment);
    }

    public String toDisplay() {
        return root.toDisplay();
    }

    public String toFunctional() {
        return root.toFunctional();
    }

    public Map<String, Object> toInterchange() {
        return root.toInterchange();
    }

    public String toJson() {
        return JsonInterchange.toJson(root);
    }

    /**
     * Enumerates every assignment of this tree's variables.
     *
     * @return the full truth table
     */
    public TruthTable truthTable() {
        return TruthTable.of(this);
    }

    /**
     * Minimizes this expression, returning the shorter of the minterm and maxterm forms.
     *
     * @param minimizer the external minimizer
     * @return the minimized expression text
     */
    public String simplify(Minimizer minimizer) {
        return simplify(minimizer, SimplifyMode.SHORTEST);
    }

    /**
     * @param minimizer the external minimizer
     * @param mode      which form to return
     * @return the minimized expression text
     */
    public String simplify(Minimizer minimizer, SimplifyMode mode) {
        return truthTable().simplify(minimizer, mode);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogicTree)) return false;
        return root.equals(((LogicTree) o).root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return toDisplay();
    }

    private static List<String> collectVariables(Node root) {
        Set<String> names = new TreeSet<>();
        root.accept(new NodeVisitor<Void>() {
            @Override
            public Void visitLeaf(Leaf leaf) {
                names.add(leaf.name());
                return null;
            }

            @Override
            public Void visitOperation(Operation operation) {
                operation.left().accept(this);
                operation.right().accept(this);
                return null;
            }
        });
        return List.copyOf(names);
    }
}
