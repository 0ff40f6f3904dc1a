package db.vtable.cli;

import java.io.PrintStream;
import java.util.List;

/**
 * Simple ASCII table printer for shell output.
 * Null cells print as {@code NULL} so they stay distinguishable from empty strings.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(List<String> headers, List<List<String>> rows, PrintStream out) {
        if (rows == null || rows.isEmpty()) {
            out.println("(0 row(s))");
            return;
        }
        int colCount = headers.size();
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers.get(i).length();
        for (List<String> r : rows) {
            for (int i = 0; i < colCount; i++) {
                String s = cell(r, i);
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }
        String divLine = buildDivider(widths);
        out.println(divLine);
        out.println(buildRow(headers, widths));
        out.println(divLine);
        for (List<String> r : rows) {
            out.println(buildRow(r, widths));
        }
        out.println(divLine);
        out.println("(" + rows.size() + " row(s))");
    }

    private static String cell(List<String> row, int i) {
        String s = i < row.size() ? row.get(i) : null;
        return s == null ? "NULL" : s;
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            for (int k = 0; k < w + 2; k++) divider.append('-');
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildRow(List<String> cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(pad(cell(cells, i), widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }
}
