package io.github.cyfko.logictree.core.exception;

/**
 * Exception thrown when an interchange map (or its JSON text) cannot be decoded into a node.
 * <p>
 * A leaf map must carry {@code name}, an operation map must carry {@code operator},
 * {@code left} and {@code right}; exactly one of {@code name} and {@code operator} must be
 * present. Invalid names and operator codes found while decoding are reported through this
 * exception with the original failure as cause.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MalformedInterchangeException extends RuntimeException {

    public MalformedInterchangeException(String message) {
        super(message);
    }

    public MalformedInterchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
