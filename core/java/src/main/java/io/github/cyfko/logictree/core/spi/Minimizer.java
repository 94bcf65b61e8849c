package io.github.cyfko.logictree.core.spi;

import java.util.List;

/**
 * External two-level minimizer (Quine-McCluskey or equivalent).
 * <p>
 * The truth-table engine calls it exactly twice per simplification: once with the minterm
 * indices and {@code maxterm = false}, once with the maxterm indices and
 * {@code maxterm = true}. Row index {@code i} uses the leftmost variable as its most
 * significant bit.
 * </p>
 *
 * <p>Implementations must be deterministic and must only reference names from
 * {@code variables} in their result.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface Minimizer {

    /**
     * @param variables ordered variable names, leftmost is the most significant bit
     * @param trueAt    ascending row indices the minimized function must cover
     * @param maxterm   whether {@code trueAt} lists maxterms (product-of-sums form expected)
     * @return the minimized expression text
     */
    String minimize(List<String> variables, List<Integer> trueAt, boolean maxterm);
}
