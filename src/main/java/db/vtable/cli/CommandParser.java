package db.vtable.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer for shell lines:
 *   verb arg ... key=value key='quoted value' key=NULL
 * Single or double quotes group whitespace; inside quotes a doubled quote is a literal
 * quote. An unquoted NULL value means SQL NULL. {@code rest} keeps the raw text after the
 * verb for commands that take free-form SQL.
 */
public class CommandParser {
    private static final Pattern VERB = Pattern.compile("^\\s*(\\S+)\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern ASSIGNMENT = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)=(.*)$", Pattern.DOTALL);

    public Command parse(String line) {
        if (line == null) throw new IllegalArgumentException("line must not be null");
        String trimmed = line.trim();
        if (trimmed.endsWith(";")) trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        Matcher m = VERB.matcher(trimmed);
        if (!m.matches()) throw new IllegalArgumentException("Empty command");
        String name = m.group(1).toLowerCase(Locale.ROOT);
        String rest = m.group(2);

        List<String> args = new ArrayList<>();
        Map<String, String> assignments = new LinkedHashMap<>();
        for (Token t : tokenize(rest)) {
            Matcher a = t.quoted() ? null : ASSIGNMENT.matcher(t.head());
            if (a != null && a.matches()) {
                String value = t.tail() != null ? t.tail() : a.group(2);
                boolean nullLiteral = t.tail() == null && value.equalsIgnoreCase("NULL");
                assignments.put(a.group(1), nullLiteral ? null : value);
            } else {
                args.add(t.text());
            }
        }
        return new Command(name, List.copyOf(args), assignments, rest);
    }

    // head: unquoted text before the first quote; tail: the quoted part, if any.
    private record Token(String text, String head, String tail, boolean quoted) {}

    private List<Token> tokenize(String s) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        int n = s.length();
        while (i < n) {
            while (i < n && Character.isWhitespace(s.charAt(i))) i++;
            if (i >= n) break;
            StringBuilder head = new StringBuilder();
            StringBuilder tail = null;
            while (i < n && !Character.isWhitespace(s.charAt(i))) {
                char c = s.charAt(i);
                if (c == '\'' || c == '"') {
                    tail = tail == null ? new StringBuilder() : tail;
                    i++;
                    while (true) {
                        if (i >= n) throw new IllegalArgumentException("Unterminated quote in: " + s);
                        char q = s.charAt(i);
                        if (q == c) {
                            if (i + 1 < n && s.charAt(i + 1) == c) {
                                tail.append(c);
                                i += 2;
                                continue;
                            }
                            i++;
                            break;
                        }
                        tail.append(q);
                        i++;
                    }
                } else {
                    (tail == null ? head : tail).append(c);
                    i++;
                }
            }
            String h = head.toString();
            String t = tail == null ? null : tail.toString();
            boolean quotedWhole = t != null && h.isEmpty();
            out.add(new Token(t == null ? h : h + t, h, t, quotedWhole));
        }
        return out;
    }
}
