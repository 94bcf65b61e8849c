package io.github.cyfko.logictree.core.exception;

/**
 * Exception thrown when an evaluation assignment has no value for a referenced variable.
 * <p>
 * Evaluation never defaults a missing variable to {@code false}; the caller must bind every
 * variable of the tree.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnboundVariableException extends RuntimeException {

    private final String variable;

    /**
     * @param variable the variable name missing from the assignment
     */
    public UnboundVariableException(String variable) {
        this(variable, String.format("No truth value bound to variable '%s'", variable));
    }

    public UnboundVariableException(String variable, String message) {
        super(message);
        this.variable = variable;
    }

    /**
     * @return the name of the unbound variable
     */
    public String getVariable() {
        return variable;
    }
}
