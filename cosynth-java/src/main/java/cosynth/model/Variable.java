package cosynth.model;

import cosynth.diag.Location;
import cosynth.types.Type;

public final class Variable extends StorageObject {
    private final String name;
    private final String owner;

    public Variable(String name, Type type, ConstantValue resetValue, String owner, Location declaredAt) {
        super(type, resetValue, declaredAt);
        this.name = name;
        this.owner = owner;
    }

    @Override
    public String name() {
        return name;
    }

    /** Name of the sequential context declaring this variable. */
    public String owner() {
        return owner;
    }
}
