package io.github.cyfko.logictree.core.table;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link TruthTable} as fixed-width text.
 * <p>
 * Each column is as wide as its label: the variable name for variable columns, the display
 * string of the expression for the result column. Cells hold {@code 1} or {@code 0}
 * centered in that width, with any odd padding character going to the right.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class TableFormatter {

    private TableFormatter() {}

    static List<String> format(TruthTable table) {
        List<String> variables = table.variables();
        String label = table.tree().toDisplay();

        List<String> headers = new ArrayList<>(variables);
        headers.add(label);

        List<String> dashes = new ArrayList<>(headers.size());
        for (String header : headers) {
            dashes.add("-".repeat(header.length()));
        }

        List<String> lines = new ArrayList<>(table.size() + 2);
        lines.add("| " + String.join(" | ", headers) + " |");
        lines.add("+-" + String.join("-+-", dashes) + "-+");

        for (TruthRow row : table.rows()) {
            List<String> cells = new ArrayList<>(headers.size());
            for (String variable : variables) {
                cells.add(center(bit(row.assignment().get(variable)), variable.length()));
            }
            cells.add(center(bit(row.result()), label.length()));
            lines.add("| " + String.join(" | ", cells) + " |");
        }

        return lines;
    }

    private static String bit(boolean value) {
        return value ? "1" : "0";
    }

    static String center(String text, int width) {
        int padding = width - text.length();
        if (padding <= 0) {
            return text;
        }
        int left = padding / 2;
        return " ".repeat(left) + text + " ".repeat(padding - left);
    }
}
