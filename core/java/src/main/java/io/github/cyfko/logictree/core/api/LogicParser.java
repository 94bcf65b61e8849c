package io.github.cyfko.logictree.core.api;

import io.github.cyfko.logictree.core.LogicTree;
import io.github.cyfko.logictree.core.exception.LogicSyntaxException;

/**
 * Parser contract for textual Boolean expressions.
 *
 * <h2>Grammar</h2>
 * <p>
 * Operators are listed from the loosest to the tightest binding; every binary level is
 * left-associative. Keywords are case-insensitive.
 * </p>
 * <table border="1">
 * <caption>Operator synonyms</caption>
 * <thead>
 * <tr><th>Operator</th><th>Accepted spellings</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>OR</td><td>{@code + | || or}</td></tr>
 * <tr><td>AND</td><td>{@code * & && and}</td></tr>
 * <tr><td>XOR</td><td>{@code ^ xor}</td></tr>
 * <tr><td>XNOR</td><td>{@code -^ xnor}</td></tr>
 * <tr><td>NOR</td><td>{@code -+ nor}</td></tr>
 * <tr><td>NAND</td><td>{@code -* nand}</td></tr>
 * <tr><td>NOT (prefix)</td><td>{@code ~ ! not}</td></tr>
 * </tbody>
 * </table>
 *
 * <pre>
 * expression := or
 * or         := and  (OR and)*
 * and        := xor  (AND xor)*
 * xor        := xnor (XOR xnor)*
 * xnor       := nor  (XNOR nor)*
 * nor        := nand (NOR nand)*
 * nand       := term (NAND term)*
 * term       := NOT term | '(' expression ')' | '[' expression ']' | identifier
 * identifier := [A-Za-z0-9]
 * </pre>
 *
 * <p>
 * NOT applies to the single term that follows it: {@code not a or b} is
 * {@code or(not(a), b)}.
 * </p>
 *
 * <h3>Invalid Expression Examples</h3>
 * <pre>{@code
 * parser.parse("");         // empty expression
 * parser.parse("a + + b");  // adjacent operators
 * parser.parse("(a + b");   // unmatched group
 * parser.parse("ab * c");   // multi-character identifier
 * parser.parse("a % b");    // unknown token
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface LogicParser {

    /**
     * Parses an expression into an immutable {@link LogicTree}.
     *
     * @param expression the text to parse; whitespace between tokens is ignored
     * @return the parsed tree with its sorted variable list
     * @throws LogicSyntaxException if the text does not match the grammar or exceeds the parser limits
     */
    LogicTree parse(String expression) throws LogicSyntaxException;
}
