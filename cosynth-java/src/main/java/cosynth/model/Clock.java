package cosynth.model;

public record Clock(Signal signal, Edge edge, Long frequency) {
    public enum Edge { RISING, FALLING, BOTH }
}
