package db.vtable.cli;

import java.util.List;
import java.util.Map;

// Parsed shell line: verb, positional arguments, key=value assignments (values may be null).
public record Command(String name, List<String> args, Map<String, String> assignments, String rest) {

    public String arg(int i) {
        if (i >= args.size()) throw new IllegalArgumentException("'" + name + "' expects argument #" + (i + 1));
        return args.get(i);
    }

    public String argOr(int i, String fallback) {
        return i < args.size() ? args.get(i) : fallback;
    }
}
