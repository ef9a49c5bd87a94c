package cosynth.model;

public enum Builtin {
    RANGE("range"),
    LEN("len"),
    ENUMERATE("enumerate"),
    ZIP("zip");

    private final String label;

    Builtin(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
