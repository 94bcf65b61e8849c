package io.github.cyfko.logictree.core.api;

import io.github.cyfko.logictree.core.exception.InvalidNameException;

/**
 * A variable reference, optionally negated.
 *
 * @param name    the variable, exactly one ASCII letter or digit
 * @param negated whether the variable is read through a NOT
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Leaf(String name, boolean negated) implements Node {

    /**
     * @throws InvalidNameException if {@code name} is not a single ASCII letter or digit
     */
    public Leaf {
        if (!isValidName(name)) {
            throw new InvalidNameException(name);
        }
    }

    /**
     * @param name the variable name
     * @return a non-negated leaf
     */
    public static Leaf of(String name) {
        return new Leaf(name, false);
    }

    /**
     * Checks the identifier rule shared by the node model and the lexer.
     *
     * @param name candidate name
     * @return true if {@code name} is exactly one ASCII letter or digit
     */
    public static boolean isValidName(String name) {
        return name != null && name.length() == 1 && isIdentifierChar(name.charAt(0));
    }

    /**
     * Character rule behind {@link #isValidName(String)}. The lexer uses it to find the
     * extent of alphanumeric runs before deciding between keyword and identifier.
     *
     * @param c candidate character
     * @return true for an ASCII letter or digit
     */
    public static boolean isIdentifierChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    @Override
    public Leaf negate() {
        return new Leaf(name, !negated);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLeaf(this);
    }

    @Override
    public String toString() {
        return toDisplay();
    }
}
