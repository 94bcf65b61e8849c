package io.github.cyfko.logictree.core.parsing;

/**
 * Lexical categories of the expression language.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    IDENTIFIER,
    BINARY_OPERATOR,
    NOT,
    OPEN_GROUP,
    CLOSE_GROUP
}
