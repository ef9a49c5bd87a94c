package cosynth.settings;

import java.util.Optional;

/** Positive integer option. */
public abstract class IntegerSetting implements Setting<Integer> {
    @Override
    public String getType() {
        return "positive integer";
    }

    @Override
    public Optional<Integer> read(String text) {
        try {
            int value = Integer.parseInt(text.trim());
            return value > 0 ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public Integer cast(Object value) {
        return (Integer) value;
    }
}
