package cosynth.types;

public enum PrimitiveType implements Type {
    BIT("bit", 1),
    BOOL("bool", 1),
    INTEGER("int", 0);

    private final String label;
    private final int width;

    PrimitiveType(String label, int width) {
        this.label = label;
        this.width = width;
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public String toString() {
        return label;
    }
}
