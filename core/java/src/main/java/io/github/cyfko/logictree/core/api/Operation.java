package io.github.cyfko.logictree.core.api;

import io.github.cyfko.logictree.core.exception.InvalidOperatorException;

import java.util.Objects;

/**
 * A binary operation over two sub-expressions, optionally negated.
 * <p>
 * {@code NAND}, {@code NOR} and {@code XNOR} are operators of their own: a NAND is never
 * stored as a negated AND. The {@code negated} flag always adds one NOT on top of the
 * operator's result.
 * </p>
 *
 * @param operator the binary operator
 * @param left     left operand, never null
 * @param right    right operand, never null
 * @param negated  whether the combined value is negated
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Operation(Operator operator, Node left, Node right, boolean negated) implements Node {

    public Operation {
        if (operator == null) {
            throw new InvalidOperatorException(null);
        }
        Objects.requireNonNull(left, "left operand cannot be null");
        Objects.requireNonNull(right, "right operand cannot be null");
    }

    /**
     * Builds a non-negated operation.
     */
    public Operation(Operator operator, Node left, Node right) {
        this(operator, left, right, false);
    }

    /**
     * Builds an operation from an operator code.
     *
     * @param operatorCode one of {@code AND, OR, XOR, XNOR, NAND, NOR} (case-insensitive)
     * @param left         left operand
     * @param right        right operand
     * @param negated      whether the result is negated
     * @return the operation
     * @throws InvalidOperatorException if the code is not recognized
     */
    public static Operation of(String operatorCode, Node left, Node right, boolean negated) {
        return new Operation(Operator.fromCode(operatorCode), left, right, negated);
    }

    @Override
    public Operation negate() {
        return new Operation(operator, left, right, !negated);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitOperation(this);
    }

    @Override
    public String toString() {
        return toDisplay();
    }
}
