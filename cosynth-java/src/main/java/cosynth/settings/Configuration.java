package cosynth.settings;

import com.google.common.flogger.GoogleLogger;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Values of the compiler settings. Settings without an explicit value fall
 * back to their default.
 */
public final class Configuration {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final Map<String, Setting<?>> known = new LinkedHashMap<>();
    private final Map<Setting<?>, Object> values = new HashMap<>();

    public Configuration() {
        for (Setting<?> s : CompilerSettings.all()) {
            known.put(s.getKey(), s);
        }
    }

    public static Configuration defaults() {
        return new Configuration();
    }

    public <T> T get(Setting<T> setting) {
        Object value = values.get(setting);
        if (value == null) return setting.defaultValue(this);
        return setting.cast(value);
    }

    public boolean isDefined(Setting<?> setting) {
        return values.containsKey(setting);
    }

    public <T> Configuration set(Setting<T> setting, T value) {
        values.put(setting, value);
        return this;
    }

    /** Sets a value from its textual form, as given on the command line. */
    public Configuration set(String key, String text) {
        Setting<?> setting = known.get(key);
        if (setting == null) {
            throw new IllegalArgumentException("Unknown setting: " + key);
        }
        Object value = setting.read(text).orElseThrow(() -> new IllegalArgumentException(
                "Invalid value '" + text + "' for setting " + key + ", expected " + setting.getType()));
        values.put(setting, value);
        logger.atFine().log("setting %s = %s", key, value);
        return this;
    }

    /** Parses a {@code key=value} pair. */
    public Configuration parseAssignment(String assignment) {
        int eq = assignment.indexOf('=');
        if (eq <= 0) {
            throw new IllegalArgumentException("Expected key=value, got: " + assignment);
        }
        return set(assignment.substring(0, eq).trim(), assignment.substring(eq + 1));
    }

    public Configuration load(Reader reader) throws IOException {
        Properties props = new Properties();
        props.load(reader);
        for (String key : props.stringPropertyNames()) {
            set(key, props.getProperty(key));
        }
        return this;
    }

    public Configuration load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read settings file " + file, e);
        }
    }
}
