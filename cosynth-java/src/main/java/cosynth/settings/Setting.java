package cosynth.settings;

import java.util.Optional;

/**
 * A typed compiler option addressed by a string key.
 */
public interface Setting<T> {
    String getKey();

    String getDescription();

    /** Human-readable name of the accepted values, used in error messages. */
    String getType();

    /** Parses a textual value; empty when the text is not acceptable. */
    Optional<T> read(String text);

    T defaultValue(Configuration configuration);

    /** Narrows a stored value back to this setting's type. */
    T cast(Object value);
}
