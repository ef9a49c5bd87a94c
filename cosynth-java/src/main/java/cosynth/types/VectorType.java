package cosynth.types;

public record VectorType(Kind kind, int width) implements Type {

    public enum Kind {
        UNSIGNED("unsigned"), SIGNED("signed"), BITVECTOR("bitvector");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public VectorType {
        if (width <= 0) throw new IllegalArgumentException("Vector width must be positive: " + width);
    }

    @Override
    public String toString() {
        return kind.label() + "<" + width + ">";
    }
}
