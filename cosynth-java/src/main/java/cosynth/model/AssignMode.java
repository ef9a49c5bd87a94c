package cosynth.model;

public enum AssignMode {
    /** {@code <<=}: delayed, visible at the end of the context's cycle. */
    NEXT("<<="),
    /** {@code ^=}: one-cycle pulse, falls back to the signal default. */
    PUSH("^="),
    /** {@code @=}: immediate, variables only. */
    VALUE("@=");

    private final String symbol;

    AssignMode(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
