package cosynth.ast.type;

// bit / bool / int
public record PrimitiveTypeRef(String name) implements TypeRef {}
