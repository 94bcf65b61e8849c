package io.github.cyfko.logictree.core.exception;

/**
 * Exception thrown when an operation is built from an operator code that is not one of
 * {@code AND}, {@code OR}, {@code XOR}, {@code XNOR}, {@code NAND} or {@code NOR}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InvalidOperatorException extends RuntimeException {

    private final String operator;

    public InvalidOperatorException(String operator) {
        super(String.format("Unknown operator code '%s'. Expected one of AND, OR, XOR, XNOR, NAND, NOR", operator));
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
