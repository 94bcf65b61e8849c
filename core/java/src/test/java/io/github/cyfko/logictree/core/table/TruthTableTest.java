package io.github.cyfko.logictree.core.table;

import io.github.cyfko.logictree.core.LogicTree;
import io.github.cyfko.logictree.core.api.Leaf;
import io.github.cyfko.logictree.core.api.Node;
import io.github.cyfko.logictree.core.api.Operation;
import io.github.cyfko.logictree.core.api.Operator;
import io.github.cyfko.logictree.core.api.SimplifyMode;
import io.github.cyfko.logictree.core.spi.Minimizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link TruthTable}.
 */
@DisplayName("TruthTable Tests")
class TruthTableTest {

    private static LogicTree orOf(int variableCount) {
        String names = "abcdefghijklmnopqrstuvwxyzABCDE";
        Node root = Leaf.of("a");
        for (int i = 1; i < variableCount; i++) {
            root = new Operation(Operator.OR, root, Leaf.of(String.valueOf(names.charAt(i))));
        }
        return LogicTree.of(root);
    }

    @Nested
    @DisplayName("Rows")
    class Rows {

        @Test
        @DisplayName("OR of two variables has four rows in binary order")
        void orRows() {
            TruthTable table = LogicTree.parse("a or b").truthTable();

            assertEquals(4, table.size());
            assertEquals(List.of(false, true, true, true),
                    table.rows().stream().map(TruthRow::result).collect(Collectors.toList()));
            assertEquals(Map.of("a", true, "b", false), table.rows().get(2).assignment());
            assertEquals(List.of("a", "b"), List.copyOf(table.rows().get(2).assignment().keySet()));
        }

        @Test
        @DisplayName("Distributed AND over OR is true exactly when a and (b or c)")
        void distributedRows() {
            TruthTable table = LogicTree.parse("a and b or a and c").truthTable();

            assertEquals(8, table.size());
            assertTrue(table.rows().get(5).result());
            assertEquals(Map.of("a", true, "b", false, "c", true), table.rows().get(5).assignment());
            assertEquals(List.of(5, 6, 7), table.minterms());
            assertEquals(List.of(0, 1, 2, 3, 4), table.maxterms());
        }

        @ParameterizedTest
        @ValueSource(strings = {"a", "~a", "a ^ b", "a -* (b -+ c)", "[a + b] * !(c -^ d)", "0 & 1 | Z"})
        @DisplayName("Rows enumerate every assignment once and agree with evaluation")
        void rowsAreExhaustive(String expression) {
            LogicTree tree = LogicTree.parse(expression);
            TruthTable table = tree.truthTable();
            int n = tree.variables().size();

            assertEquals(1 << n, table.size());
            Set<Map<String, Boolean>> seen = new HashSet<>();
            for (TruthRow row : table.rows()) {
                for (int j = 0; j < n; j++) {
                    boolean bit = ((row.index() >> (n - 1 - j)) & 1) == 1;
                    assertEquals(bit, row.assignment().get(tree.variables().get(j)));
                }
                assertEquals(tree.evaluate(row.assignment()), row.result());
                assertTrue(seen.add(row.assignment()));
            }
            assertEquals(table.size(), table.minterms().size() + table.maxterms().size());
        }

        @Test
        @DisplayName("Trees with more than 20 variables are rejected before enumeration")
        void tooManyVariables() {
            LogicTree tree = orOf(TruthTable.MAX_VARIABLES + 1);

            assertEquals(21, tree.variables().size());
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, tree::truthTable);
            assertEquals("Cannot enumerate 21 variables (max: 20)", e.getMessage());
        }

        @Test
        @DisplayName("A table at the variable ceiling is fully enumerated")
        void ceilingIsEnumerable() {
            TruthTable table = orOf(TruthTable.MAX_VARIABLES).truthTable();

            assertEquals(1 << 20, table.size());
            assertEquals(List.of(0), table.maxterms());
            assertEquals((1 << 20) - 1, table.minterms().size());
            assertFalse(table.rows().get(0).result());
            assertTrue(table.rows().get((1 << 20) - 1).assignment().values().stream().allMatch(Boolean::booleanValue));
        }

        @Test
        @DisplayName("Rows view is read-only and bounds-checked")
        void rowsView() {
            TruthTable table = LogicTree.parse("a ^ b").truthTable();

            assertEquals(table.rows().get(1), table.rows().get(1));
            assertThrows(IndexOutOfBoundsException.class, () -> table.rows().get(4));
            assertThrows(UnsupportedOperationException.class, () -> table.rows().remove(0));
            assertThrows(UnsupportedOperationException.class, () -> table.rows().get(0).assignment().put("a", true));
        }
    }

    @Nested
    @DisplayName("Format")
    class Format {

        @Test
        @DisplayName("OR of two variables renders header, separator and centered cells")
        void orTable() {
            TruthTable table = LogicTree.parse("a or b").truthTable();

            assertEquals(List.of(
                    "| a | b | a OR b |",
                    "+---+---+--------+",
                    "| 0 | 0 |   0    |",
                    "| 0 | 1 |   1    |",
                    "| 1 | 0 |   1    |",
                    "| 1 | 1 |   1    |"
            ), table.formatLines());
            assertEquals(String.join("\n", table.formatLines()), table.format());
            assertEquals(table.format(), table.toString());
        }

        @Test
        @DisplayName("Values are centered in their column")
        void centered() {
            assertEquals(List.of(
                    "| a | NOT a |",
                    "+---+-------+",
                    "| 0 |   1   |",
                    "| 1 |   0   |"
            ), LogicTree.parse("!a").truthTable().formatLines());
        }
    }

    @Nested
    @DisplayName("Simplify")
    class Simplify {

        private static final List<String> VARIABLES = List.of("a", "b", "c");
        private static final List<Integer> MINTERMS = List.of(5, 6, 7);
        private static final List<Integer> MAXTERMS = List.of(0, 1, 2, 3, 4);

        @Mock
        private Minimizer minimizer;

        private TruthTable table;

        @BeforeEach
        void setUp() {
            MockitoAnnotations.openMocks(this);
            table = LogicTree.parse("a and b or a and c").truthTable();
        }

        @Test
        @DisplayName("Calls the minimizer once per form, minterms first")
        void callsMinimizerTwice() {
            when(minimizer.minimize(VARIABLES, MINTERMS, false)).thenReturn("ab + ac");
            when(minimizer.minimize(VARIABLES, MAXTERMS, true)).thenReturn("(a)(b + c)");

            table.simplify(minimizer, SimplifyMode.MINTERM);

            InOrder inOrder = inOrder(minimizer);
            inOrder.verify(minimizer).minimize(VARIABLES, MINTERMS, false);
            inOrder.verify(minimizer).minimize(VARIABLES, MAXTERMS, true);
            verifyNoMoreInteractions(minimizer);
        }

        @Test
        @DisplayName("Returns the requested form")
        void requestedForm() {
            when(minimizer.minimize(VARIABLES, MINTERMS, false)).thenReturn("ab + ac");
            when(minimizer.minimize(VARIABLES, MAXTERMS, true)).thenReturn("(a)(b + c)");

            assertEquals("ab + ac", table.simplify(minimizer, SimplifyMode.MINTERM));
            assertEquals("(a)(b + c)", table.simplify(minimizer, SimplifyMode.MAXTERM));
        }

        @Test
        @DisplayName("Shortest picks the strictly shorter form")
        void shortest() {
            when(minimizer.minimize(VARIABLES, MINTERMS, false)).thenReturn("ab + ac");
            when(minimizer.minimize(VARIABLES, MAXTERMS, true)).thenReturn("a(b+c)");

            assertEquals("a(b+c)", table.simplify(minimizer, SimplifyMode.SHORTEST));
        }

        @Test
        @DisplayName("Shortest keeps the minterm form on a tie")
        void shortestTie() {
            when(minimizer.minimize(VARIABLES, MINTERMS, false)).thenReturn("ab+ac");
            when(minimizer.minimize(VARIABLES, MAXTERMS, true)).thenReturn("(a+b)");

            assertEquals("ab+ac", table.simplify(minimizer, SimplifyMode.SHORTEST));
        }

        @Test
        @DisplayName("A contradiction passes an empty minterm list")
        void contradiction() {
            TruthTable never = LogicTree.parse("a & ~a").truthTable();
            when(minimizer.minimize(List.of("a"), List.of(), false)).thenReturn("0");
            when(minimizer.minimize(List.of("a"), List.of(0, 1), true)).thenReturn("0");

            assertEquals("0", never.simplify(minimizer, SimplifyMode.SHORTEST));
            verify(minimizer).minimize(List.of("a"), List.of(), false);
        }
    }
}
