package cosynth.types;

public sealed interface Type permits PrimitiveType, VectorType {
    /** Number of bits in hardware; 0 for the unbounded compile-time integer. */
    int width();
}
