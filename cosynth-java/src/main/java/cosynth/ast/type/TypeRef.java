package cosynth.ast.type;

public sealed interface TypeRef permits PrimitiveTypeRef, VectorTypeRef {}
