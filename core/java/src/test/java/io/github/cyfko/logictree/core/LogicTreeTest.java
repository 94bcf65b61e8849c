package io.github.cyfko.logictree.core;

import io.github.cyfko.logictree.core.api.Leaf;
import io.github.cyfko.logictree.core.api.LogicParser;
import io.github.cyfko.logictree.core.api.Node;
import io.github.cyfko.logictree.core.api.Operation;
import io.github.cyfko.logictree.core.api.Operator;
import io.github.cyfko.logictree.core.config.CachePolicy;
import io.github.cyfko.logictree.core.config.ParserPolicy;
import io.github.cyfko.logictree.core.exception.LogicSyntaxException;
import io.github.cyfko.logictree.core.exception.MalformedInterchangeException;
import io.github.cyfko.logictree.core.exception.UnboundVariableException;
import io.github.cyfko.logictree.core.spi.Minimizer;
import io.github.cyfko.logictree.core.table.TruthRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests through the {@link LogicTree} entry point.
 */
@DisplayName("LogicTree Tests")
class LogicTreeTest {

    private static List<Boolean> results(LogicTree tree) {
        return tree.truthTable().rows().stream().map(TruthRow::result).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Round trips through the entry point")
    class RoundTrips {

        @Test
        @DisplayName("Parse and evaluate a or b")
        void parseAndEvaluate() {
            LogicTree tree = LogicTree.parse("a or b");

            assertEquals(List.of("a", "b"), tree.variables());
            assertFalse(tree.evaluate(Map.of("a", false, "b", false)));
            assertTrue(tree.evaluate(Map.of("a", true, "b", false)));
        }

        @Test
        @DisplayName("Negated leaf renders in both forms")
        void negatedLeaf() {
            LogicTree tree = LogicTree.parse("not a");

            assertEquals("NOT a", tree.toDisplay());
            assertEquals("not(a)", tree.toFunctional());
            assertEquals("NOT a", tree.toString());
        }

        @Test
        @DisplayName("Distributed and factored forms share a truth table")
        void factoredEquivalence() {
            LogicTree distributed = LogicTree.parse("a and b or a and c");
            LogicTree factored = LogicTree.parse("a * (b + c)");

            assertTrue(distributed.evaluate(Map.of("a", true, "b", false, "c", true)));
            assertEquals(results(distributed), results(factored));
            assertNotEquals(distributed, factored);
        }

        @Test
        @DisplayName("Interchange decoding renders the expected display")
        void interchange() {
            Map<String, Object> map = Map.of(
                    "operator", "OR",
                    "left", Map.of("name", "a", "negated", false),
                    "right", Map.of("name", "b", "negated", true),
                    "negated", false);

            LogicTree tree = LogicTree.fromInterchange(map);

            assertEquals("a OR NOT b", tree.toDisplay());
            assertEquals(List.of("a", "b"), tree.variables());
            assertEquals(map, tree.toInterchange());
        }

        @Test
        @DisplayName("JSON round trip preserves the tree")
        void json() {
            LogicTree tree = LogicTree.parse("~(a -* b) ^ c");
            assertEquals(tree, LogicTree.fromJson(tree.toJson()));
            assertThrows(MalformedInterchangeException.class, () -> LogicTree.fromJson("{}"));
        }
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        @ParameterizedTest
        @ValueSource(strings = {
                "a",
                "not a or b",
                "a * (b + c)",
                "a and b or a and c",
                "not (a -* b) -* c",
                "a -* (b -* c)",
                "~a ^ [b xnor c]",
                "a nor b nor c",
                "!(a + b) * c",
                "a + b * c ^ d -^ e -+ f -* g",
                "(a + b) -* (c + d)",
                "~~(a & 1) | 0"
        })
        @DisplayName("Parsing the display text yields the same tree")
        void displayReparses(String expression) {
            LogicTree tree = LogicTree.parse(expression);
            LogicTree reparsed = LogicTree.parse(tree.toDisplay());

            assertEquals(tree, reparsed);
            assertEquals(results(tree), results(reparsed));
        }

        @Test
        @DisplayName("Equality is structural")
        void equality() {
            LogicTree parsed = LogicTree.parse("a & !b");
            LogicTree built = LogicTree.of(new Operation(Operator.AND, Leaf.of("a"), new Leaf("b", true)));

            assertEquals(parsed, built);
            assertEquals(parsed.hashCode(), built.hashCode());
            assertNotEquals(parsed, LogicTree.parse("a & b"));
        }

        @Test
        @DisplayName("Variables list is unmodifiable")
        void unmodifiableVariables() {
            assertThrows(UnsupportedOperationException.class, () -> LogicTree.parse("a + b").variables().add("c"));
        }
    }

    @Nested
    @DisplayName("Errors and collaborators")
    class Errors {

        @Test
        @DisplayName("Evaluation requires every variable")
        void unbound() {
            assertThrows(UnboundVariableException.class, () -> LogicTree.parse("a + b").evaluate(Map.of("b", true)));
        }

        @Test
        @DisplayName("Default parsing applies no size limits")
        void defaultParserIsUnlimited() {
            String seventeen = "a + b + c + d + e + f + g + h + i + j + k + l + m + n + o + p + q";
            LogicTree wide = LogicTree.parse(seventeen);
            assertEquals(17, wide.variables().size());
            assertEquals(wide, LogicTree.parse(LogicTree.of(wide.root()).toDisplay()));

            String longText = "a" + " + a".repeat(1300);
            assertTrue(longText.length() > 5000);
            assertEquals(List.of("a"), LogicTree.parse(longText).variables());
        }

        @Test
        @DisplayName("A decoded wide tree parses back from its display text")
        void wideInterchangeReparses() {
            String names = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
            Node root = Leaf.of("a");
            for (int i = 1; i < names.length(); i++) {
                root = new Operation(Operator.XOR, root, Leaf.of(String.valueOf(names.charAt(i))));
            }
            LogicTree decoded = LogicTree.fromInterchange(LogicTree.of(root).toInterchange());

            assertEquals(62, decoded.variables().size());
            assertEquals(decoded, LogicTree.parse(decoded.toDisplay()));
        }

        @Test
        @DisplayName("Parsing with a custom parser applies its policy")
        void customParser() {
            LogicParser strict = LogicTree.parser(ParserPolicy.builder().maxVariables(2).build(), CachePolicy.none());
            assertThrows(LogicSyntaxException.class, () -> LogicTree.parse("a + b + c", strict));
            assertEquals(2, LogicTree.parse("a + b", strict).variables().size());
        }

        @Test
        @DisplayName("simplify defaults to the shortest form")
        void simplifyDefault() {
            Minimizer minimizer = mock(Minimizer.class);
            when(minimizer.minimize(anyList(), anyList(), eq(false))).thenReturn("a + b");
            when(minimizer.minimize(anyList(), anyList(), eq(true))).thenReturn("(a + b)");

            assertEquals("a + b", LogicTree.parse("a or b").simplify(minimizer));
            verify(minimizer, times(2)).minimize(anyList(), anyList(), anyBoolean());
        }
    }
}
