package cosynth.ast.decl;

import cosynth.ast.expr.Expr;
import cosynth.ast.type.TypeRef;
import cosynth.diag.Location;
import cosynth.model.PortDirection;

public record PortDecl(
        String name,
        PortDirection direction,
        TypeRef type,
        Expr defaultValue,       // may be null
        Location loc
) {}
