package io.github.cyfko.logictree.core.parsing;

import io.github.cyfko.logictree.core.api.Leaf;
import io.github.cyfko.logictree.core.api.Node;
import io.github.cyfko.logictree.core.api.Operation;
import io.github.cyfko.logictree.core.exception.LogicSyntaxException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Builds an expression tree from postfix tokens in a single pass.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * For each token in postfix expression:
 *   - IDENTIFIER: push Leaf(name, negated = false)
 *   - NOT:        pop operand, push it with its negated flag flipped
 *   - BINARY:     pop right, pop left, push Operation(op, left, right, negated = false)
 *
 * Stack should contain exactly ONE node at the end.
 * </pre>
 *
 * <p>
 * A NOT over an operation flips that operation's own flag, so {@code ~(a + b)} becomes a
 * negated OR and {@code ~~a} is a plain leaf again.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see PostfixConverter
 */
public final class PostfixTreeBuilder {

    private PostfixTreeBuilder() {
        // Utility class - prevent instantiation
    }

    /**
     * @param postfixTokens tokens produced by {@link PostfixConverter}
     * @return the root node
     * @throws LogicSyntaxException if the token list does not describe exactly one expression
     */
    public static Node build(List<Token> postfixTokens) {
        if (postfixTokens == null || postfixTokens.isEmpty()) {
            throw new LogicSyntaxException("Cannot build a tree from an empty postfix expression");
        }

        Deque<Node> stack = new ArrayDeque<>();

        for (Token token : postfixTokens) {
            switch (token.type()) {
                case IDENTIFIER -> stack.push(Leaf.of(token.text()));

                case NOT -> {
                    if (stack.isEmpty()) {
                        throw new LogicSyntaxException(String.format(
                                "Malformed postfix expression: NOT %s without operand", token.describe()));
                    }
                    stack.push(stack.pop().negate());
                }

                case BINARY_OPERATOR -> {
                    if (stack.size() < 2) {
                        throw new LogicSyntaxException(String.format(
                                "Malformed postfix expression: operator %s requires two operands, stack holds %d",
                                token.describe(), stack.size()));
                    }
                    Node right = stack.pop();
                    Node left = stack.pop();
                    stack.push(new Operation(token.operator(), left, right, false));
                }

                default -> throw new LogicSyntaxException(String.format(
                        "Malformed postfix expression: unexpected grouping token %s", token.describe()));
            }
        }

        if (stack.size() != 1) {
            throw new LogicSyntaxException(String.format(
                    "Malformed postfix expression: evaluation resulted in %d nodes on stack (expected 1)",
                    stack.size()));
        }

        return stack.pop();
    }
}
