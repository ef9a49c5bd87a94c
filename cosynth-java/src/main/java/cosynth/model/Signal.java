package cosynth.model;

import cosynth.diag.Location;
import cosynth.types.Type;

public final class Signal extends StorageObject {
    private final String name;
    private final PortDirection direction;
    private final boolean generated;

    public Signal(String name, Type type, ConstantValue defaultValue, PortDirection direction,
                  boolean generated, Location declaredAt) {
        super(type, defaultValue, declaredAt);
        this.name = name;
        this.direction = direction;
        this.generated = generated;
    }

    public static Signal internal(String name, Type type, ConstantValue defaultValue, Location at) {
        return new Signal(name, type, defaultValue, null, false, at);
    }

    public static Signal port(String name, PortDirection direction, Type type, ConstantValue defaultValue, Location at) {
        return new Signal(name, type, defaultValue, direction, false, at);
    }

    /** Signals the compiler adds: port buffers and state registers. */
    public static Signal generated(String name, Type type, ConstantValue defaultValue) {
        return new Signal(name, type, defaultValue, null, true, Location.UNKNOWN);
    }

    @Override
    public String name() {
        return name;
    }

    public boolean isPort() {
        return direction != null;
    }

    /** Port direction, null for internal signals. */
    public PortDirection direction() {
        return direction;
    }

    public boolean isGenerated() {
        return generated;
    }
}
