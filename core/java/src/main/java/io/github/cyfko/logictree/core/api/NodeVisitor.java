package io.github.cyfko.logictree.core.api;

/**
 * Visitor over the two node variants.
 * <p>
 * Every consumer of the node model (evaluation, formatting, interchange encoding) goes through
 * this interface, so adding a variant fails to compile until each consumer handles it.
 * </p>
 *
 * @param <R> the result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface NodeVisitor<R> {

    R visitLeaf(Leaf leaf);

    R visitOperation(Operation operation);
}
