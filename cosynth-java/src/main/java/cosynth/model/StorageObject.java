package cosynth.model;

import cosynth.diag.Location;
import cosynth.types.Type;

/**
 * Synthesizable, runtime-mutable entity. Identity matters: two bindings to the
 * same instance are aliases.
 */
public abstract sealed class StorageObject implements Value permits Signal, Variable, Temporary {
    private final Type type;
    private final ConstantValue defaultValue;
    private final Location declaredAt;

    protected StorageObject(Type type, ConstantValue defaultValue, Location declaredAt) {
        this.type = type;
        this.defaultValue = defaultValue;
        this.declaredAt = declaredAt == null ? Location.UNKNOWN : declaredAt;
    }

    public abstract String name();

    public Type type() {
        return type;
    }

    /** Reset value, or null when the object has none. */
    public ConstantValue defaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public Location declaredAt() {
        return declaredAt;
    }

    @Override
    public String toString() {
        return name();
    }
}
