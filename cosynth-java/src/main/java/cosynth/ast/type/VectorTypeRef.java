package cosynth.ast.type;

// unsigned<N> / signed<N> / bitvector<N>
public record VectorTypeRef(String kind, int width) implements TypeRef {}
