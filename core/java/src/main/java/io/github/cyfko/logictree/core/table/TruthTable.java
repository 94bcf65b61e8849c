package io.github.cyfko.logictree.core.table;

import io.github.cyfko.logictree.core.LogicTree;
import io.github.cyfko.logictree.core.api.SimplifyMode;
import io.github.cyfko.logictree.core.eval.Evaluator;
import io.github.cyfko.logictree.core.spi.Minimizer;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.RandomAccess;
import java.util.logging.Logger;

/**
 * Exhaustive truth table of a {@link LogicTree}.
 * <p>
 * For {@code n} variables the table has {@code 2^n} rows in ascending binary order: in row
 * {@code i}, variable {@code j} takes bit {@code n-1-j} of {@code i}, so the leftmost variable
 * is the most significant bit.
 * </p>
 *
 * <h2>Layout</h2>
 * <pre>
 * | a | b | a OR b |
 * +---+---+--------+
 * | 0 | 0 |   0    |
 * | 0 | 1 |   1    |
 * | 1 | 0 |   1    |
 * | 1 | 1 |   1    |
 * </pre>
 *
 * <h2>Storage</h2>
 * <p>
 * Only the result column is kept, one bit per row. {@link #rows()} is a read-only view that
 * builds each {@link TruthRow} when it is accessed.
 * </p>
 *
 * <h2>Simplification</h2>
 * <p>
 * {@link #simplify(Minimizer, SimplifyMode)} always calls the minimizer twice, first with the
 * minterm indices, then with the maxterm indices, and picks the requested form.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTable {

    private static final Logger log = Logger.getLogger(TruthTable.class.getName());

    /**
     * Largest variable count that can be enumerated: 2^20 rows, a 128 KiB result column and
     * minterm or maxterm lists of at most a million indices.
     */
    public static final int MAX_VARIABLES = 20;

    private final LogicTree tree;
    private final int rowCount;
    private final BitSet results;
    private final List<TruthRow> rows;

    private TruthTable(LogicTree tree, int rowCount, BitSet results) {
        this.tree = tree;
        this.rowCount = rowCount;
        this.results = results;
        this.rows = new RowView();
    }

    /**
     * Evaluates the tree under every assignment of its variables.
     *
     * @param tree the expression
     * @return the table
     * @throws IllegalArgumentException if the tree has more than {@link #MAX_VARIABLES} variables
     */
    public static TruthTable of(LogicTree tree) {
        Objects.requireNonNull(tree, "tree cannot be null");
        List<String> variables = tree.variables();
        int n = variables.size();
        if (n > MAX_VARIABLES) {
            throw new IllegalArgumentException(String.format(
                    "Cannot enumerate %d variables (max: %d)", n, MAX_VARIABLES));
        }

        int rowCount = 1 << n;
        BitSet results = new BitSet(rowCount);
        Map<String, Boolean> assignment = new HashMap<>(n * 2);
        for (int i = 0; i < rowCount; i++) {
            for (int j = 0; j < n; j++) {
                assignment.put(variables.get(j), bitOf(i, j, n));
            }
            if (Evaluator.evaluate(tree.root(), assignment)) {
                results.set(i);
            }
        }
        return new TruthTable(tree, rowCount, results);
    }

    public LogicTree tree() {
        return tree;
    }

    public List<String> variables() {
        return tree.variables();
    }

    /**
     * @return all rows in ascending index order
     */
    public List<TruthRow> rows() {
        return rows;
    }

    public int size() {
        return rowCount;
    }

    /**
     * @return ascending indices of the rows where the expression is true
     */
    public List<Integer> minterms() {
        return indicesWhere(true);
    }

    /**
     * @return ascending indices of the rows where the expression is false
     */
    public List<Integer> maxterms() {
        return indicesWhere(false);
    }

    /**
     * Minimizes the expression through the external minimizer.
     *
     * @param minimizer the collaborator, called exactly twice
     * @param mode      which result to return; {@link SimplifyMode#SHORTEST} prefers the minterm form on ties
     * @return the minimized expression text
     */
    public String simplify(Minimizer minimizer, SimplifyMode mode) {
        Objects.requireNonNull(minimizer, "minimizer cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");

        List<String> variables = variables();
        List<Integer> minterms = minterms();
        List<Integer> maxterms = maxterms();

        String mintermForm = minimizer.minimize(variables, minterms, false);
        String maxtermForm = minimizer.minimize(variables, maxterms, true);
        log.fine(() -> String.format("Minimized '%s': minterms %s -> '%s', maxterms %s -> '%s'",
                tree.toDisplay(), minterms, mintermForm, maxterms, maxtermForm));

        return switch (mode) {
            case MINTERM -> mintermForm;
            case MAXTERM -> maxtermForm;
            case SHORTEST -> maxtermForm.length() < mintermForm.length() ? maxtermForm : mintermForm;
        };
    }

    /**
     * @return the table as text, lines joined with {@code \n}
     */
    public String format() {
        return String.join("\n", formatLines());
    }

    /**
     * @return header line, separator line, then one line per row
     */
    public List<String> formatLines() {
        return TableFormatter.format(this);
    }

    @Override
    public String toString() {
        return format();
    }

    private List<Integer> indicesWhere(boolean value) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < rowCount; i++) {
            if (results.get(i) == value) {
                indices.add(i);
            }
        }
        return Collections.unmodifiableList(indices);
    }

    private static boolean bitOf(int index, int variable, int variableCount) {
        return (index & (1 << (variableCount - 1 - variable))) != 0;
    }

    private final class RowView extends AbstractList<TruthRow> implements RandomAccess {

        @Override
        public TruthRow get(int index) {
            Objects.checkIndex(index, rowCount);
            List<String> variables = tree.variables();
            int n = variables.size();
            Map<String, Boolean> assignment = new LinkedHashMap<>(n * 2);
            for (int j = 0; j < n; j++) {
                assignment.put(variables.get(j), bitOf(index, j, n));
            }
            return new TruthRow(index, Collections.unmodifiableMap(assignment), results.get(index));
        }

        @Override
        public int size() {
            return rowCount;
        }
    }
}
