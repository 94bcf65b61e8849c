package io.github.cyfko.logictree.core.exception;

/**
 * Exception thrown when a leaf is built with a name that is not a single ASCII letter or digit.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InvalidNameException extends RuntimeException {

    private final String name;

    public InvalidNameException(String name) {
        super(String.format("Invalid variable name '%s': a variable is exactly one letter or digit", name));
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
