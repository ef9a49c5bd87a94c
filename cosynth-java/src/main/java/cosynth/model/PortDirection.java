package cosynth.model;

public enum PortDirection {
    IN, OUT, INOUT;

    public boolean isReadable() {
        return this != OUT;
    }

    public boolean isWritable() {
        return this != IN;
    }
}
