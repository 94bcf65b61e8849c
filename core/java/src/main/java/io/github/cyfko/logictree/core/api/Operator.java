package io.github.cyfko.logictree.core.api;

import io.github.cyfko.logictree.core.exception.InvalidOperatorException;

import java.util.Locale;

/**
 * The six binary operators of the expression language.
 * <p>
 * Each constant carries its canonical symbol, its upper-case code (used in display and
 * interchange forms) and its binding strength. Levels go from the loosest ({@link #OR}) to the
 * tightest ({@link #NAND}); unary NOT binds tighter than all of them.
 * </p>
 *
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Precedence</th><th>combine(l, r)</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>OR</td><td>+</td><td>1</td><td>l or r</td></tr>
 * <tr><td>AND</td><td>*</td><td>2</td><td>l and r</td></tr>
 * <tr><td>XOR</td><td>^</td><td>3</td><td>l xor r</td></tr>
 * <tr><td>XNOR</td><td>-^</td><td>4</td><td>not (l xor r)</td></tr>
 * <tr><td>NOR</td><td>-+</td><td>5</td><td>not (l or r)</td></tr>
 * <tr><td>NAND</td><td>-*</td><td>6</td><td>not (l and r)</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Operator {

    /** Disjunction: "+" */
    OR("+", 1),

    /** Conjunction: "*" */
    AND("*", 2),

    /** Exclusive disjunction: "^" */
    XOR("^", 3),

    /** Negated exclusive disjunction: "-^" */
    XNOR("-^", 4),

    /** Negated disjunction: "-+" */
    NOR("-+", 5),

    /** Negated conjunction: "-*" */
    NAND("-*", 6);

    /**
     * Binding strength of unary NOT, tighter than every binary level.
     */
    public static final int NOT_PRECEDENCE = 7;

    private final String symbol;
    private final int precedence;

    Operator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    /**
     * @return the canonical symbol of this operator
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return the upper-case operator code, e.g. {@code "XNOR"}
     */
    public String getCode() {
        return name();
    }

    /**
     * @return the lower-case function name used by the functional form, e.g. {@code "nand"}
     */
    public String getFunctionName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return binding strength, higher binds tighter
     */
    public int getPrecedence() {
        return precedence;
    }

    /**
     * Combines two operand values according to this operator's truth table.
     *
     * @param left  value of the left operand
     * @param right value of the right operand
     * @return the combined value
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case OR -> left || right;
            case NOR -> !(left || right);
            case AND -> left && right;
            case NAND -> !(left && right);
            case XOR -> left ^ right;
            case XNOR -> !(left ^ right);
        };
    }

    /**
     * Resolves an operator from its code, ignoring case and surrounding whitespace.
     *
     * @param code the operator code, e.g. {@code "or"} or {@code "NAND"}
     * @return the matching operator
     * @throws InvalidOperatorException if the code does not name one of the six operators
     */
    public static Operator fromCode(String code) {
        if (code == null) {
            throw new InvalidOperatorException(null);
        }

        String trimmed = code.trim();
        for (Operator op : values()) {
            if (op.name().equalsIgnoreCase(trimmed)) return op;
        }

        throw new InvalidOperatorException(code);
    }
}
