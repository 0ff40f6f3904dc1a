package db.vtable.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import db.vtable.storage.CentsTransform;

/**
 * Settings for one versioned table. Later sources override earlier ones:
 * built-in defaults, {@code vtable.json} on the classpath, a file named by
 * {@code --config=}, then individual command-line flags.
 */
public class VTableConfig {
    public static final String CLASSPATH_RESOURCE = "vtable.json";

    public final Path databasePath;
    public final String tableName;
    public final String ledgerTableName;
    public final String defaultActor;
    public final int listLimit;
    public final String monetarySuffix;

    public VTableConfig(Path databasePath,
                        String tableName,
                        String ledgerTableName,
                        String defaultActor,
                        int listLimit,
                        String monetarySuffix) {
        if (listLimit <= 0) throw new IllegalArgumentException("listLimit must be positive, got " + listLimit);
        this.databasePath = databasePath;
        this.tableName = tableName;
        this.ledgerTableName = ledgerTableName != null ? ledgerTableName : tableName + "_field_versions";
        this.defaultActor = defaultActor;
        this.listLimit = listLimit;
        this.monetarySuffix = monetarySuffix;
    }

    public static VTableConfig defaultConfig() {
        return new VTableConfig(
                Path.of("catalog.db"),
                "product",
                null,               // derived from table name
                "web",
                200,                // rows/versions per listing
                CentsTransform.DEFAULT_SUFFIX
        );
    }

    /** Defaults overlaid with the classpath resource, when present. */
    public static VTableConfig load() {
        VTableConfig cfg = defaultConfig();
        try (InputStream in = VTableConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) return cfg;
            return cfg.overlay(read(new InputStreamReader(in, StandardCharsets.UTF_8), CLASSPATH_RESOURCE));
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading classpath config " + CLASSPATH_RESOURCE, e);
        }
    }

    public static VTableConfig fromFile(VTableConfig base, Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return base.overlay(read(reader, file.toString()));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file " + file, e);
        }
    }

    public static VTableConfig fromArgs(String[] args) {
        VTableConfig cfg = load();
        for (String a : args) {
            if (a != null && a.trim().startsWith("--config=")) {
                cfg = fromFile(cfg, Path.of(a.trim().substring("--config=".length())));
            }
        }
        Overrides flags = new Overrides();
        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--db=")) {
                flags.databasePath = s.substring("--db=".length());
            } else if (s.startsWith("--table=")) {
                flags.tableName = s.substring("--table=".length());
            } else if (s.startsWith("--actor=")) {
                flags.defaultActor = s.substring("--actor=".length());
            } else if (s.startsWith("--limit=")) {
                String raw = s.substring("--limit=".length());
                try {
                    flags.listLimit = Integer.parseInt(raw);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("--limit expects a number, got '" + raw + "'", e);
                }
            } else if (!s.startsWith("--config=")) {
                throw new IllegalArgumentException("Unknown argument: " + s);
            }
        }
        return cfg.overlay(flags);
    }

    VTableConfig overlay(Overrides o) {
        String table = o.tableName != null ? o.tableName : tableName;
        // A renamed table gets its own derived ledger unless one is named explicitly.
        String ledger = o.ledgerTableName != null ? o.ledgerTableName
            : (o.tableName != null ? null : ledgerTableName);
        return new VTableConfig(
                o.databasePath != null ? Path.of(o.databasePath) : databasePath,
                table,
                ledger,
                o.defaultActor != null ? o.defaultActor : defaultActor,
                o.listLimit != null ? o.listLimit : listLimit,
                o.monetarySuffix != null ? o.monetarySuffix : monetarySuffix);
    }

    private static Overrides read(Reader reader, String source) {
        try {
            Overrides o = new Gson().fromJson(reader, Overrides.class);
            return o != null ? o : new Overrides();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed config " + source + ": " + e.getMessage(), e);
        }
    }

    // JSON shape; null means "not set here".
    static final class Overrides {
        String databasePath;
        String tableName;
        String ledgerTableName;
        String defaultActor;
        Integer listLimit;
        String monetarySuffix;
    }

    @Override
    public String toString() {
        return "VTableConfig{db=" + databasePath + ", table=" + tableName + ", ledger=" + ledgerTableName
            + ", actor=" + defaultActor + ", limit=" + listLimit + ", monetarySuffix=" + monetarySuffix + "}";
    }
}
