package db.vtable.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;

import db.vtable.VersionedTable;
import db.vtable.VersionedTableException;
import db.vtable.catalog.ColumnDescriptor;
import db.vtable.ledger.RollbackResult;
import db.vtable.ledger.SortOrder;
import db.vtable.ledger.VersionEntry;
import db.vtable.ledger.VersionSortField;
import db.vtable.storage.Record;

/**
 * Line-oriented operator console over a {@link VersionedTable}.
 */
public class OperatorShell {
    static final String HELP = String.join("\n",
        "columns                                 list current columns",
        "schema                                  show the stored CREATE statement",
        "add-column <name> <type> [default]      INTEGER | REAL | TEXT | BLOB",
        "drop-column <name>",
        "modify-column <old> <new> <type> [default]",
        "create field=value ...",
        "get <id>",
        "update <id> field=value ...",
        "delete <id>",
        "list [limit]",
        "compare <id> <id> ...",
        "export [limit]                          records as JSON",
        "versions [recordId] [limit=N] [sort=field] [order=asc|desc]",
        "version <id>",
        "rollback <versionId>",
        "raw <sql>                               privileged, executed verbatim",
        "help | exit");

    private final VersionedTable table;
    private final CommandParser parser = new CommandParser();
    private final PrintStream out;
    private final String actor;
    private final int defaultLimit;

    public OperatorShell(VersionedTable table, String actor, int defaultLimit, PrintStream out) {
        this.table = table;
        this.actor = actor;
        this.defaultLimit = defaultLimit;
        this.out = out;
    }

    /** Runs one line; returns false when the shell should stop. */
    public boolean execute(String line) {
        if (line == null) return false;
        if (line.isBlank()) return true;
        try {
            Command cmd = parser.parse(line);
            return dispatch(cmd);
        } catch (VersionedTableException e) {
            out.println("Error [" + e.code() + "]: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
        }
        return true;
    }

    private boolean dispatch(Command cmd) {
        switch (cmd.name()) {
            case "exit", "quit" -> {
                out.println("Bye");
                return false;
            }
            case "help" -> out.println(HELP);
            case "columns" -> printColumns(table.listColumns());
            case "schema" -> out.println(table.getDefinitionStatement().orElse("(no table)"));
            case "add-column" -> {
                table.addColumn(cmd.arg(0), cmd.arg(1), cmd.argOr(2, null));
                out.println("Added column " + cmd.arg(0) + " " + cmd.arg(1).toUpperCase(Locale.ROOT));
            }
            case "drop-column" -> {
                table.dropColumn(cmd.arg(0));
                out.println("Dropped column " + cmd.arg(0));
            }
            case "modify-column" -> {
                table.modifyColumn(cmd.arg(0), cmd.arg(1), cmd.arg(2), cmd.argOr(3, null));
                out.println("Modified column " + cmd.arg(0) + " -> " + cmd.arg(1) + " (" + cmd.arg(2).toUpperCase(Locale.ROOT) + ")");
            }
            case "create" -> {
                long id = table.createRecord(cmd.assignments(), actor("create"));
                out.println("Created record " + id);
            }
            case "get" -> printRecords(List.of(table.getRecord(parseId(cmd.arg(0)))));
            case "update" -> {
                List<VersionEntry> changes = table.updateRecord(parseId(cmd.arg(0)), cmd.assignments(), actor("edit"));
                out.println("Updated record " + cmd.arg(0) + " (" + changes.size() + " field(s) changed)");
            }
            case "delete" -> {
                table.deleteRecord(parseId(cmd.arg(0)));
                out.println("Deleted record " + cmd.arg(0));
            }
            case "list" -> printRecords(table.listRecords(parseLimit(cmd.argOr(0, null))));
            case "compare" -> {
                List<Long> ids = new ArrayList<>();
                for (String a : cmd.args()) ids.add(parseId(a));
                if (ids.size() < 2) throw new IllegalArgumentException("compare expects at least two ids");
                printRecords(table.getRecords(ids));
            }
            case "export" -> out.println(table.exportRecordsJson(parseLimit(cmd.argOr(0, null))));
            case "versions" -> {
                OptionalLong recordId = cmd.args().isEmpty() ? OptionalLong.empty() : OptionalLong.of(parseId(cmd.arg(0)));
                int limit = parseLimit(cmd.assignments().get("limit"));
                String sort = cmd.assignments().get("sort");
                String order = cmd.assignments().get("order");
                printVersions(table.listVersions(recordId, limit,
                    sort == null ? VersionSortField.ID : VersionSortField.parse(sort),
                    order == null ? SortOrder.DESC : SortOrder.parse(order)));
            }
            case "version" -> {
                long id = parseId(cmd.arg(0));
                table.getVersion(id).ifPresentOrElse(v -> printVersions(List.of(v)),
                    () -> out.println("Version " + id + " not found"));
            }
            case "rollback" -> {
                RollbackResult r = table.rollback(parseId(cmd.arg(0)), actor("web"));
                if (r.isApplied()) {
                    out.println(r.message() + " (version " + r.logged().get().id() + ")");
                } else {
                    out.println("Rollback rejected [" + r.rejection().get() + "]: " + r.message());
                }
            }
            case "raw" -> {
                table.runRawStatement(cmd.rest(), actor("web"));
                out.println("OK");
            }
            default -> out.println("Unknown command '" + cmd.name() + "' (try help)");
        }
        return true;
    }

    private String actor(String fallback) {
        return actor != null ? actor : fallback;
    }

    private void printColumns(List<ColumnDescriptor> columns) {
        List<List<String>> rows = new ArrayList<>();
        for (ColumnDescriptor c : columns) {
            rows.add(List.of(c.name().name(), c.type().sqlName(), c.nullable() ? "0" : "1",
                c.primaryKey() ? "1" : "0", c.defaultValue().orElse("")));
        }
        TablePrinter.print(List.of("name", "type", "notnull", "pk", "default"), rows, out);
    }

    private void printRecords(List<Record> records) {
        if (records.isEmpty()) {
            TablePrinter.print(List.of(), List.of(), out);
            return;
        }
        List<String> headers = new ArrayList<>(records.get(0).getValues().keySet());
        List<List<String>> rows = new ArrayList<>();
        for (Record r : records) {
            List<String> row = new ArrayList<>();
            for (String h : headers) row.add(r.display(h));
            rows.add(row);
        }
        TablePrinter.print(headers, rows, out);
    }

    private void printVersions(List<VersionEntry> versions) {
        List<List<String>> rows = new ArrayList<>();
        for (VersionEntry v : versions) {
            List<String> row = new ArrayList<>();
            row.add(Long.toString(v.id()));
            row.add(Long.toString(v.recordId()));
            row.add(v.fieldName());
            row.add(v.oldValue().orElse(null));
            row.add(v.newValue().orElse(null));
            row.add(String.valueOf(v.timestamp()));
            row.add(v.actor());
            rows.add(row);
        }
        TablePrinter.print(List.of("id", "record_id", "field_name", "old_value", "new_value", "changed_at", "changed_by"),
            rows, out);
    }

    private int parseLimit(String raw) {
        if (raw == null) return defaultLimit;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number, got '" + raw + "'", e);
        }
    }

    private static long parseId(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a numeric id, got '" + raw + "'", e);
        }
    }
}
