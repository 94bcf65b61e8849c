package io.github.cyfko.logictree.core.exception;

import io.github.cyfko.logictree.core.api.LogicParser;
import io.github.cyfko.logictree.core.impl.GrammarLogicParser;

/**
 * Exception thrown when a textual logic expression does not match the grammar.
 * <p>
 * Raised by the parsing pipeline for every kind of malformed input. Messages carry the
 * offending token and its zero-based position when one can be identified.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Empty input:</strong> {@code null}, empty or blank expression</li>
 *   <li><strong>Unbalanced grouping:</strong> missing {@code )} or {@code ]}, or {@code (a]}</li>
 *   <li><strong>Adjacent operators:</strong> {@code a + + b}</li>
 *   <li><strong>Multi-character identifiers:</strong> {@code ab & c}</li>
 *   <li><strong>Unknown tokens:</strong> {@code a % b}</li>
 *   <li><strong>Policy limits:</strong> expression too long, too many distinct variables</li>
 * </ul>
 *
 * <pre>{@code
 * try {
 *     LogicTree tree = parser.parse(userExpression);
 * } catch (LogicSyntaxException e) {
 *     log.warning("Rejected expression '" + userExpression + "': " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see LogicParser
 * @see GrammarLogicParser
 */
public class LogicSyntaxException extends RuntimeException {

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing the syntax error, ideally with a position
     */
    public LogicSyntaxException(String message) {
        super(message);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the syntax error
     * @param cause   the original failure
     */
    public LogicSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
