package io.github.cyfko.logictree.core.format;

import io.github.cyfko.logictree.core.api.Leaf;
import io.github.cyfko.logictree.core.api.Node;
import io.github.cyfko.logictree.core.api.NodeVisitor;
import io.github.cyfko.logictree.core.api.Operation;

/**
 * Text renderings of an expression tree.
 *
 * <h2>Display form</h2>
 * <ul>
 *   <li>Leaf: {@code a} or {@code NOT a}</li>
 *   <li>Operation: {@code left OP right} or {@code NOT (left OP right)}</li>
 * </ul>
 * <p>
 * A non-negated operand operation is wrapped in parentheses when it binds looser than its
 * parent, or equally tight on the right-hand side, so that the display text parses back to
 * an equivalent tree: {@code AND(a, OR(b, c))} renders as {@code a AND (b OR c)}.
 * </p>
 *
 * <h2>Functional form</h2>
 * <ul>
 *   <li>Leaf: {@code a} or {@code not(a)}</li>
 *   <li>Operation: {@code or(a, b)} or {@code not(or(a, b))}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NodeFormatter {

    private static final NodeVisitor<String> FUNCTIONAL = new NodeVisitor<>() {
        @Override
        public String visitLeaf(Leaf leaf) {
            return leaf.negated() ? "not(" + leaf.name() + ")" : leaf.name();
        }

        @Override
        public String visitOperation(Operation operation) {
            String call = String.format("%s(%s, %s)",
                    operation.operator().getFunctionName(),
                    operation.left().accept(this),
                    operation.right().accept(this));
            return operation.negated() ? "not(" + call + ")" : call;
        }
    };

    private static final NodeVisitor<String> DISPLAY = new NodeVisitor<>() {
        @Override
        public String visitLeaf(Leaf leaf) {
            return leaf.negated() ? "NOT " + leaf.name() : leaf.name();
        }

        @Override
        public String visitOperation(Operation operation) {
            int precedence = operation.operator().getPrecedence();
            String infix = operand(operation.left(), precedence, false)
                    + " " + operation.operator().getCode() + " "
                    + operand(operation.right(), precedence, true);
            return operation.negated() ? "NOT (" + infix + ")" : infix;
        }

        private String operand(Node child, int parentPrecedence, boolean rightHand) {
            String text = child.accept(this);
            if (child instanceof Operation childOperation && !childOperation.negated()) {
                int childPrecedence = childOperation.operator().getPrecedence();
                if (childPrecedence < parentPrecedence || (rightHand && childPrecedence == parentPrecedence)) {
                    return "(" + text + ")";
                }
            }
            return text;
        }
    };

    private NodeFormatter() {}

    /**
     * @param node the tree to render
     * @return the infix display text
     */
    public static String display(Node node) {
        return node.accept(DISPLAY);
    }

    /**
     * @param node the tree to render
     * @return the prefix-call text
     */
    public static String functional(Node node) {
        return node.accept(FUNCTIONAL);
    }
}
