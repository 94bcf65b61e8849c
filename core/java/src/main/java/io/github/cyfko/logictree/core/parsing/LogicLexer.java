package io.github.cyfko.logictree.core.parsing;

import io.github.cyfko.logictree.core.api.Leaf;
import io.github.cyfko.logictree.core.exception.LogicSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an expression into {@link Token}s using a {@link LogicGrammar}.
 * <p>
 * Whitespace separates tokens and is otherwise ignored. An alphanumeric run is either a
 * keyword ({@code and}, {@code Or}, {@code NOT}...) or a one-character identifier; longer
 * runs are rejected, so {@code ab} is an error rather than two variables.
 * </p>
 *
 * <pre>{@code
 * LogicLexer.tokenize("a && !b", LogicGrammar.STANDARD);
 * // [IDENTIFIER 'a'@0, BINARY_OPERATOR '&&'@2, NOT '!'@5, IDENTIFIER 'b'@6]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LogicLexer {

    private LogicLexer() {}

    /**
     * @param expression the source text
     * @param grammar    the spelling table
     * @return tokens in source order, possibly empty for blank input
     * @throws LogicSyntaxException on an unknown character or a multi-character identifier
     */
    public static List<Token> tokenize(String expression, LogicGrammar grammar) {
        List<Token> tokens = new ArrayList<>();
        int length = expression.length();
        int i = 0;

        while (i < length) {
            char c = expression.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (Leaf.isIdentifierChar(c)) {
                int end = i;
                while (end < length && Leaf.isIdentifierChar(expression.charAt(end))) {
                    end++;
                }
                tokens.add(word(expression.substring(i, end), i, grammar));
                i = end;
                continue;
            }

            Token symbol = grammar.matchSymbol(expression, i);
            if (symbol == null) {
                throw new LogicSyntaxException(String.format(
                        "Unrecognized token '%c' at position %d", c, i));
            }
            tokens.add(symbol);
            i += symbol.text().length();
        }

        return tokens;
    }

    private static Token word(String word, int position, LogicGrammar grammar) {
        Token keyword = grammar.matchWord(word, position);
        if (keyword != null) {
            return keyword;
        }
        if (word.length() > 1) {
            throw new LogicSyntaxException(String.format(
                    "Invalid identifier '%s' at position %d: variables are single letters or digits", word, position));
        }
        return Token.identifier(word, position);
    }
}
