package cosynth.sema;

import cosynth.ast.type.PrimitiveTypeRef;
import cosynth.ast.type.TypeRef;
import cosynth.ast.type.VectorTypeRef;
import cosynth.diag.CompileException;
import cosynth.diag.ErrorKind;
import cosynth.diag.Location;
import cosynth.types.PrimitiveType;
import cosynth.types.Type;
import cosynth.types.VectorType;

public final class TypeResolver {

    public Type resolve(TypeRef ref, Location at) {
        if (ref instanceof PrimitiveTypeRef p) {
            return switch (p.name()) {
                case "bit" -> PrimitiveType.BIT;
                case "bool" -> PrimitiveType.BOOL;
                case "int" -> PrimitiveType.INTEGER;
                default -> throw new CompileException(ErrorKind.UNSUPPORTED_CONSTRUCT, at, "Unknown type: " + p.name());
            };
        }
        VectorTypeRef v = (VectorTypeRef) ref;
        VectorType.Kind kind = switch (v.kind()) {
            case "unsigned" -> VectorType.Kind.UNSIGNED;
            case "signed" -> VectorType.Kind.SIGNED;
            case "bitvector" -> VectorType.Kind.BITVECTOR;
            default -> throw new CompileException(ErrorKind.UNSUPPORTED_CONSTRUCT, at, "Unknown type: " + v.kind());
        };
        if (v.width() <= 0) {
            throw new CompileException(ErrorKind.UNSUPPORTED_CONSTRUCT, at, "Vector width must be positive");
        }
        return new VectorType(kind, v.width());
    }
}
