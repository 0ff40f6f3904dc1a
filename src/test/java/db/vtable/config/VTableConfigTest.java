package db.vtable.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class VTableConfigTest {

    @TempDir
    Path dir;

    @Test
    void defaultsDeriveTheLedgerName() {
        VTableConfig cfg = VTableConfig.defaultConfig();
        assertEquals("product", cfg.tableName);
        assertEquals("product_field_versions", cfg.ledgerTableName);
        assertEquals("web", cfg.defaultActor);
        assertEquals(200, cfg.listLimit);
        assertEquals("_cents", cfg.monetarySuffix);
    }

    @Test
    void flagsOverrideTheClasspathResource() {
        VTableConfig cfg = VTableConfig.fromArgs(new String[] {"--db=shop.db", "--table=item", "--actor=ops", "--limit=5"});
        assertEquals(Path.of("shop.db"), cfg.databasePath);
        assertEquals("item", cfg.tableName);
        assertEquals("item_field_versions", cfg.ledgerTableName);
        assertEquals("ops", cfg.defaultActor);
        assertEquals(5, cfg.listLimit);
    }

    @Test
    void configFileIsOverlaid() throws Exception {
        Path file = dir.resolve("vt.json");
        Files.writeString(file, "{\"tableName\":\"widget\",\"ledgerTableName\":\"widget_audit\",\"listLimit\":10}",
            StandardCharsets.UTF_8);

        VTableConfig cfg = VTableConfig.fromArgs(new String[] {"--config=" + file, "--actor=batch"});

        assertEquals("widget", cfg.tableName);
        assertEquals("widget_audit", cfg.ledgerTableName);
        assertEquals(10, cfg.listLimit);
        assertEquals("batch", cfg.defaultActor);
        assertEquals(Path.of("catalog.db"), cfg.databasePath);
    }

    @Test
    void badInputIsRejected() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> VTableConfig.fromArgs(new String[] {"--verbose"}));
        assertThrows(IllegalArgumentException.class, () -> VTableConfig.fromArgs(new String[] {"--limit=many"}));
        assertThrows(IllegalArgumentException.class, () -> VTableConfig.fromArgs(new String[] {"--limit=0"}));

        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{ not json", StandardCharsets.UTF_8);
        assertThrows(IllegalArgumentException.class,
            () -> VTableConfig.fromFile(VTableConfig.defaultConfig(), broken));
        assertThrows(IllegalArgumentException.class,
            () -> VTableConfig.fromFile(VTableConfig.defaultConfig(), dir.resolve("missing.json")));
    }
}
