package cosynth.settings;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigurationTest {

    @Test
    void defaults() {
        Configuration c = Configuration.defaults();
        assertEquals(64, c.get(CompilerSettings.maxInlineDepth));
        assertEquals(4096, c.get(CompilerSettings.maxStates));
        assertEquals(65536, c.get(CompilerSettings.maxUnroll));
        assertFalse(c.get(CompilerSettings.strictTemporaries));
        assertEquals("_buf", c.get(CompilerSettings.bufferSuffix));
        assertFalse(c.isDefined(CompilerSettings.maxStates));
    }

    @Test
    void parse_assignment() {
        Configuration c = new Configuration()
                .parseAssignment("max-states=12")
                .parseAssignment("buffer-suffix= _reg ")
                .parseAssignment("strict-temporaries=ON");
        assertEquals(12, c.get(CompilerSettings.maxStates));
        assertEquals("_reg", c.get(CompilerSettings.bufferSuffix));
        assertTrue(c.get(CompilerSettings.strictTemporaries));
        assertTrue(c.isDefined(CompilerSettings.maxStates));
    }

    @Test
    void values_come_back_with_their_setting_type() {
        Configuration c = new Configuration()
                .set(CompilerSettings.maxUnroll, 8)
                .parseAssignment("max-inline-depth=5");
        Integer unroll = c.get(CompilerSettings.maxUnroll);
        Integer depth = c.get(CompilerSettings.maxInlineDepth);
        assertEquals(8, unroll);
        assertEquals(5, depth);
        assertEquals("_buf", CompilerSettings.bufferSuffix.cast("_buf"));
        assertThrows(ClassCastException.class, () -> CompilerSettings.maxUnroll.cast("8"));
    }

    @Test
    void on_off_values() {
        assertEquals(true, CompilerSettings.strictTemporaries.read("true").orElseThrow());
        assertEquals(false, CompilerSettings.strictTemporaries.read(" off").orElseThrow());
        assertTrue(CompilerSettings.strictTemporaries.read("maybe").isEmpty());
    }

    @Test
    void rejects_unknown_keys_and_bad_values() {
        Configuration c = new Configuration();
        var unknown = assertThrows(IllegalArgumentException.class, () -> c.parseAssignment("colour=red"));
        assertTrue(unknown.getMessage().contains("colour"));

        var bad = assertThrows(IllegalArgumentException.class, () -> c.parseAssignment("max-states=-1"));
        assertTrue(bad.getMessage().contains("positive integer"), bad.getMessage());

        assertThrows(IllegalArgumentException.class, () -> c.parseAssignment("max-states"));
        assertThrows(IllegalArgumentException.class, () -> c.parseAssignment("=3"));
        assertThrows(IllegalArgumentException.class, () -> c.parseAssignment("buffer-suffix=  "));
        assertEquals(4096, c.get(CompilerSettings.maxStates));
    }

    @Test
    void loads_properties() throws IOException {
        Configuration c = new Configuration();
        try (Reader r = new InputStreamReader(
                getClass().getResourceAsStream("/test-settings.properties"), StandardCharsets.UTF_8)) {
            c.load(r);
        }
        assertEquals(16, c.get(CompilerSettings.maxStates));
        assertTrue(c.get(CompilerSettings.strictTemporaries));
        assertEquals(64, c.get(CompilerSettings.maxInlineDepth));
    }
}
