package io.github.cyfko.logictree.core.parsing;

import io.github.cyfko.logictree.core.config.ParserPolicy;
import io.github.cyfko.logictree.core.exception.LogicSyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Infix to postfix conversion with fail-fast syntax validation.
 * <p>
 * Runs the Shunting-Yard algorithm over the tokens of {@link LogicLexer}, using the
 * precedence levels of {@link io.github.cyfko.logictree.core.api.Operator}. Binary operators
 * are left-associative. NOT is a right-associative prefix operator binding tighter than any
 * binary operator, so it captures exactly one following term.
 * </p>
 *
 * <p><strong>Token transitions:</strong></p>
 * <pre>
 * expecting an operand:  identifier | NOT | open group
 * expecting an operator: binary operator | close group | end of input
 * </pre>
 * <p>Any other transition is a syntax error reported with the token position.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> postfix = PostfixConverter.toPostfix("not a or b", ParserPolicy.defaults());
 * // a ! b or   (NOT applies to a only)
 *
 * List<Token> grouped = PostfixConverter.toPostfix("~(a + b)", ParserPolicy.defaults());
 * // a b + ~
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PostfixConverter {

    private PostfixConverter() {}

    /**
     * Converts an expression into postfix tokens.
     *
     * @param expression the source text
     * @param policy     the limits to enforce
     * @return postfix tokens, never empty
     * @throws LogicSyntaxException if the expression is blank, too long or malformed
     */
    public static List<Token> toPostfix(String expression, ParserPolicy policy) {
        if (expression == null || expression.isBlank()) {
            throw new LogicSyntaxException("Logic expression cannot be null or empty");
        }

        if (expression.length() > policy.maxExpressionLength()) {
            throw new LogicSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    expression.length(), policy.maxExpressionLength(), policy.policyName()
            ));
        }

        return convert(LogicLexer.tokenize(expression, LogicGrammar.STANDARD), LogicGrammar.STANDARD);
    }

    static List<Token> convert(List<Token> tokens, LogicGrammar grammar) {
        List<Token> output = new ArrayList<>(tokens.size());
        Deque<Token> operators = new ArrayDeque<>();
        boolean expectOperand = true;

        for (Token token : tokens) {
            switch (token.type()) {
                case IDENTIFIER -> {
                    if (!expectOperand) {
                        throw missingOperator(token);
                    }
                    output.add(token);
                    expectOperand = false;
                }

                case NOT, OPEN_GROUP -> {
                    if (!expectOperand) {
                        throw missingOperator(token);
                    }
                    operators.push(token);
                }

                case BINARY_OPERATOR -> {
                    if (expectOperand) {
                        throw new LogicSyntaxException(String.format(
                                "Operator %s has no left operand", token.describe()));
                    }
                    while (!operators.isEmpty()
                            && operators.peek().type() != TokenType.OPEN_GROUP
                            && operators.peek().precedence() >= token.precedence()) {
                        output.add(operators.pop());
                    }
                    operators.push(token);
                    expectOperand = true;
                }

                case CLOSE_GROUP -> {
                    if (expectOperand) {
                        throw new LogicSyntaxException(String.format(
                                "Expected an operand before %s", token.describe()));
                    }
                    while (!operators.isEmpty() && operators.peek().type() != TokenType.OPEN_GROUP) {
                        output.add(operators.pop());
                    }
                    if (operators.isEmpty()) {
                        throw new LogicSyntaxException(String.format(
                                "Mismatched grouping: unmatched %s", token.describe()));
                    }
                    Token open = operators.pop();
                    String expected = grammar.closerOf(open.text());
                    if (!expected.equals(token.text())) {
                        throw new LogicSyntaxException(String.format(
                                "Mismatched grouping: %s is closed by %s, expected '%s'",
                                open.describe(), token.describe(), expected));
                    }
                }
            }
        }

        if (output.isEmpty() && operators.isEmpty()) {
            throw new LogicSyntaxException("Logic expression cannot be null or empty");
        }

        if (expectOperand) {
            Token last = tokens.get(tokens.size() - 1);
            throw new LogicSyntaxException(String.format(
                    "Expression ends with %s: an operand is missing", last.describe()));
        }

        while (!operators.isEmpty()) {
            Token op = operators.pop();
            if (op.type() == TokenType.OPEN_GROUP) {
                throw new LogicSyntaxException(String.format(
                        "Mismatched grouping: unmatched %s", op.describe()));
            }
            output.add(op);
        }

        return output;
    }

    private static LogicSyntaxException missingOperator(Token token) {
        return new LogicSyntaxException(String.format(
                "Missing operator before %s", token.describe()));
    }
}
