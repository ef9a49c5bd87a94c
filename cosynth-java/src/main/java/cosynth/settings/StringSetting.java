package cosynth.settings;

import java.util.Optional;

public abstract class StringSetting implements Setting<String> {
    @Override
    public String getType() {
        return "string";
    }

    @Override
    public Optional<String> read(String text) {
        String value = text.trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    @Override
    public String cast(Object value) {
        return (String) value;
    }
}
