package net.parley.util.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DynamicConfigurationTest {

    private static Configuration of(String... pairs) {
        Properties props = new Properties();
        for (int i = 0; i < pairs.length; i += 2)
            props.setProperty(pairs[i], pairs[i + 1]);
        return new PropertiesConfiguration(props);
    }

    @Test
    void overridesThenSourcesInOrder() {
        DynamicConfiguration cfg = new DynamicConfiguration();
        cfg.addSource(of("a", "first", "b", "first"));
        cfg.addSource(of("b", "second", "c", "second"));
        cfg.put("a", "override");

        assertEquals("override", cfg.get("a"));
        assertEquals("first", cfg.get("b"));
        assertEquals("second", cfg.get("c"));
        assertNull(cfg.get("d"));
        assertEquals("dflt", cfg.get("d", "dflt"));

        cfg.remove("a");
        assertEquals("first", cfg.get("a"));
    }

    @Test
    void numbersFallBackToDefaultWhenUnparsable() {
        DynamicConfiguration cfg = new DynamicConfiguration();
        cfg.put("parley.port", " 9000 ");
        cfg.put("parley.gc.interval", "soon");

        assertEquals(9000, cfg.getInt("parley.port", 8080));
        assertEquals(60000L, cfg.getLong("parley.gc.interval", 60000L));
        assertEquals(5, cfg.getInt("missing", 5));
    }

    @Test
    void booleansAcceptCommonSpellings() {
        DynamicConfiguration cfg = new DynamicConfiguration();
        cfg.put("x", "yes");
        cfg.put("y", "0");

        assertTrue(cfg.getBoolean("x"));
        assertFalse(cfg.getBoolean("y"));
        assertFalse(cfg.getBoolean("z"));
    }

    @Test
    void loadsPropertiesFile(@TempDir Path dir) throws IOException {
        File file = dir.resolve("parley.properties").toFile();
        Files.write(file.toPath(),
            "parley.port=7000\nparley.audit=on\n".getBytes(
                StandardCharsets.ISO_8859_1));
        DynamicConfiguration cfg = new DynamicConfiguration();

        cfg.addSource(PropertiesConfiguration.load(file));

        assertEquals(7000, cfg.getInt("parley.port", 8080));
        assertTrue(cfg.getBoolean("parley.audit"));
    }

}
