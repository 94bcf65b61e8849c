package io.github.cyfko.logictree.core.table;

import java.util.Map;

/**
 * One row of a truth table.
 *
 * @param index      row number; its binary digits are the variable values, leftmost variable first
 * @param assignment variable values in variable order, unmodifiable
 * @param result     value of the expression for this assignment
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthRow(int index, Map<String, Boolean> assignment, boolean result) {}
