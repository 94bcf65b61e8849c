package io.github.cyfko.logictree.core.eval;

import io.github.cyfko.logictree.core.api.Leaf;
import io.github.cyfko.logictree.core.api.Node;
import io.github.cyfko.logictree.core.api.NodeVisitor;
import io.github.cyfko.logictree.core.api.Operation;
import io.github.cyfko.logictree.core.exception.UnboundVariableException;

import java.util.Map;
import java.util.Objects;

/**
 * Computes the value of an expression tree under a variable assignment.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * Leaf:      assignment[name] XOR negated
 * Operation: operator.apply(eval(left), eval(right)) XOR negated
 * </pre>
 *
 * <p>
 * Both operands are always evaluated, so an unbound variable is reported even where a
 * short-circuit would not have needed it.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Evaluator {

    private Evaluator() {
        // Utility class - prevent instantiation
    }

    /**
     * Evaluates {@code node} against {@code assignment}.
     *
     * @param node       the expression to evaluate
     * @param assignment a truth value for every variable of {@code node}
     * @return the value of the expression
     * @throws UnboundVariableException if a referenced variable has no (or a null) value
     * @throws NullPointerException     if node or assignment is null
     */
    public static boolean evaluate(Node node, Map<String, Boolean> assignment) {
        Objects.requireNonNull(node, "node cannot be null");
        Objects.requireNonNull(assignment, "assignment cannot be null");
        return node.accept(new AssignmentVisitor(assignment));
    }

    private static final class AssignmentVisitor implements NodeVisitor<Boolean> {
        private final Map<String, Boolean> assignment;

        AssignmentVisitor(Map<String, Boolean> assignment) {
            this.assignment = assignment;
        }

        @Override
        public Boolean visitLeaf(Leaf leaf) {
            Boolean value = assignment.get(leaf.name());
            if (value == null) {
                throw new UnboundVariableException(leaf.name());
            }
            return value ^ leaf.negated();
        }

        @Override
        public Boolean visitOperation(Operation operation) {
            boolean left = operation.left().accept(this);
            boolean right = operation.right().accept(this);
            return operation.operator().apply(left, right) ^ operation.negated();
        }
    }
}
