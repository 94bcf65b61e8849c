package io.github.cyfko.logictree.core.api;

import io.github.cyfko.logictree.core.eval.Evaluator;
import io.github.cyfko.logictree.core.format.InterchangeCodec;
import io.github.cyfko.logictree.core.format.NodeFormatter;

import java.util.Map;

/**
 * A node of a Boolean expression tree: either a {@link Leaf} or an {@link Operation}.
 * <p>
 * Nodes are immutable values with structural equality. A tree has no cycles and no shared
 * mutable parts, so it can be shared freely between threads. Every node carries a
 * {@code negated} flag meaning "one more NOT on top of whatever this node evaluates to".
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Node expr = new Operation(Operator.OR, Leaf.of("a"), Leaf.of("b").negate(), false);
 *
 * expr.toDisplay();     // "a OR NOT b"
 * expr.toFunctional();  // "or(a, not(b))"
 * expr.evaluate(Map.of("a", false, "b", false)); // true
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see NodeVisitor
 */
public sealed interface Node permits Leaf, Operation {

    /**
     * @return whether an extra NOT is applied to this node's value
     */
    boolean negated();

    /**
     * @return a copy of this node with the {@code negated} flag flipped
     */
    Node negate();

    <R> R accept(NodeVisitor<R> visitor);

    /**
     * Evaluates this node against a complete variable assignment.
     *
     * @param assignment truth value of every variable referenced by this node
     * @return the value of the expression
     * @throws io.github.cyfko.logictree.core.exception.UnboundVariableException if a referenced variable is missing
     */
    default boolean evaluate(Map<String, Boolean> assignment) {
        return Evaluator.evaluate(this, assignment);
    }

    /**
     * @return the infix rendering, e.g. {@code a AND NOT b}
     */
    default String toDisplay() {
        return NodeFormatter.display(this);
    }

    /**
     * @return the prefix-call rendering, e.g. {@code and(a, not(b))}
     */
    default String toFunctional() {
        return NodeFormatter.functional(this);
    }

    /**
     * @return the nested-map interchange form of this node
     */
    default Map<String, Object> toInterchange() {
        return InterchangeCodec.encode(this);
    }

    /**
     * Rebuilds a node from its interchange form.
     *
     * @param interchange a map produced by {@link #toInterchange()} or an equivalent JSON document
     * @return the decoded node
     * @throws io.github.cyfko.logictree.core.exception.MalformedInterchangeException if the map is not a valid node
     */
    static Node fromInterchange(Map<String, ?> interchange) {
        return InterchangeCodec.decode(interchange);
    }
}
