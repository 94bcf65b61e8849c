package io.github.cyfko.logictree.core.api;

/**
 * Which minimized form {@link io.github.cyfko.logictree.core.LogicTree#simplify} returns.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum SimplifyMode {

    /** Sum-of-products form built from the rows where the expression is true. */
    MINTERM,

    /** Product-of-sums form built from the rows where the expression is false. */
    MAXTERM,

    /** The shorter of the two forms; the minterm form wins ties. */
    SHORTEST
}
