package db.vtable;

import java.util.Arrays;
import java.util.Scanner;

import db.vtable.cli.OperatorShell;
import db.vtable.config.VTableConfig;

/**
 * Operator console. Flags: --db=PATH --table=NAME --actor=NAME --limit=N --config=FILE
 */
public class Main {
    public static void main(String[] args) {
        VTableConfig config;
        try {
            config = VTableConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
            return;
        }
        // Without an explicit --actor the shell tags changes create/edit/web per command.
        String actor = Arrays.stream(args).anyMatch(a -> a != null && a.startsWith("--actor=")) ? config.defaultActor : null;

        try (VersionedTable table = VersionedTable.open(config);
             Scanner scanner = new Scanner(System.in)) {
            System.out.println("Table '" + table.table() + "' in " + config.databasePath + " (type help)\n");
            OperatorShell shell = new OperatorShell(table, actor, config.listLimit, System.out);
            while (true) {
                System.out.print("vtable> ");
                if (!scanner.hasNextLine()) break;
                if (!shell.execute(scanner.nextLine())) break;
            }
        }
    }
}
