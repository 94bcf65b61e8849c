package io.github.cyfko.logictree.core.parsing;

import io.github.cyfko.logictree.core.api.Operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The lexical table of the expression language: operator spellings and grouping delimiters.
 * <p>
 * A single immutable instance, {@link #STANDARD}, is built when the class is loaded and
 * shared by every parser. Precedence is fixed by {@link Operator}; this table only maps
 * spellings to token kinds.
 * </p>
 *
 * <ul>
 *   <li>Symbols are matched longest first, so {@code &&} wins over {@code &} and {@code -^} is never read as {@code -}</li>
 *   <li>Words are matched case-insensitively and only as whole alphanumeric runs</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LogicGrammar {

    /**
     * The standard grammar.
     */
    public static final LogicGrammar STANDARD = new LogicGrammar();

    private final Map<String, Operator> operatorSymbols = new LinkedHashMap<>();
    private final Map<String, Operator> operatorWords = new LinkedHashMap<>();
    private final List<String> notSymbols = List.of("~", "!");
    private final List<String> notWords = List.of("not");
    private final Map<String, String> groups = Map.of("(", ")", "[", "]");
    private final List<String> symbolsLongestFirst;

    private LogicGrammar() {
        operator(Operator.OR, List.of("+", "|", "||"), "or");
        operator(Operator.AND, List.of("*", "&", "&&"), "and");
        operator(Operator.XOR, List.of("^"), "xor");
        operator(Operator.XNOR, List.of("-^"), "xnor");
        operator(Operator.NOR, List.of("-+"), "nor");
        operator(Operator.NAND, List.of("-*"), "nand");

        List<String> symbols = new ArrayList<>(operatorSymbols.keySet());
        symbols.addAll(notSymbols);
        symbols.addAll(groups.keySet());
        symbols.addAll(groups.values());
        symbols.sort(Comparator.comparingInt(String::length).reversed());
        this.symbolsLongestFirst = Collections.unmodifiableList(symbols);
    }

    private void operator(Operator operator, List<String> symbols, String word) {
        for (String symbol : symbols) {
            operatorSymbols.put(symbol, operator);
        }
        operatorWords.put(word, operator);
    }

    /**
     * Matches the longest symbol starting at {@code position}.
     *
     * @param text     the source expression
     * @param position offset to match at
     * @return the token, or null if no symbol starts there
     */
    public Token matchSymbol(String text, int position) {
        for (String symbol : symbolsLongestFirst) {
            if (text.startsWith(symbol, position)) {
                return symbolToken(symbol, position);
            }
        }
        return null;
    }

    /**
     * Matches a complete alphanumeric run against the keyword table.
     *
     * @param word     the run
     * @param position offset of the run
     * @return the keyword token, or null if {@code word} is not a keyword
     */
    public Token matchWord(String word, int position) {
        String lower = word.toLowerCase(Locale.ROOT);
        Operator operator = operatorWords.get(lower);
        if (operator != null) {
            return Token.binary(operator, word, position);
        }
        if (notWords.contains(lower)) {
            return Token.of(TokenType.NOT, word, position);
        }
        return null;
    }

    /**
     * @param open an opening delimiter
     * @return the delimiter that closes it
     */
    public String closerOf(String open) {
        return groups.get(open);
    }

    private Token symbolToken(String symbol, int position) {
        Operator operator = operatorSymbols.get(symbol);
        if (operator != null) {
            return Token.binary(operator, symbol, position);
        }
        if (notSymbols.contains(symbol)) {
            return Token.of(TokenType.NOT, symbol, position);
        }
        if (groups.containsKey(symbol)) {
            return Token.of(TokenType.OPEN_GROUP, symbol, position);
        }
        return Token.of(TokenType.CLOSE_GROUP, symbol, position);
    }
}
