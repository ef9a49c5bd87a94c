package cosynth.settings;

import java.util.Optional;

public abstract class OnOffSetting implements Setting<Boolean> {
    @Override
    public String getType() {
        return "on/off";
    }

    @Override
    public Optional<Boolean> read(String text) {
        switch (text.trim().toLowerCase()) {
            case "on":
            case "true":
                return Optional.of(true);
            case "off":
            case "false":
                return Optional.of(false);
            default:
                return Optional.empty();
        }
    }

    @Override
    public Boolean cast(Object value) {
        return (Boolean) value;
    }
}
