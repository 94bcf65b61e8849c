package io.github.cyfko.logictree.core.parsing;

import io.github.cyfko.logictree.core.api.Operator;

import java.util.Objects;

/**
 * A lexical token with its source text and zero-based position.
 *
 * @param type     lexical category
 * @param text     the exact source text of the token
 * @param position offset of the first character in the source expression
 * @param operator the binary operator, only set for {@link TokenType#BINARY_OPERATOR}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String text, int position, Operator operator) {

    public Token {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
        if ((type == TokenType.BINARY_OPERATOR) != (operator != null)) {
            throw new IllegalArgumentException("operator must be set exactly for binary operator tokens");
        }
    }

    public static Token identifier(String name, int position) {
        return new Token(TokenType.IDENTIFIER, name, position, null);
    }

    public static Token binary(Operator operator, String text, int position) {
        return new Token(TokenType.BINARY_OPERATOR, text, position, operator);
    }

    public static Token of(TokenType type, String text, int position) {
        return new Token(type, text, position, null);
    }

    /**
     * @return binding strength on the operator stack; 0 for non-operators
     */
    public int precedence() {
        return switch (type) {
            case BINARY_OPERATOR -> operator.getPrecedence();
            case NOT -> Operator.NOT_PRECEDENCE;
            default -> 0;
        };
    }

    /**
     * @return a short description for error messages, e.g. {@code '&&' at position 4}
     */
    public String describe() {
        return String.format("'%s' at position %d", text, position);
    }
}
