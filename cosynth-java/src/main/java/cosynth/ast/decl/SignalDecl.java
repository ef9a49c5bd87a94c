package cosynth.ast.decl;

import cosynth.ast.expr.Expr;
import cosynth.ast.type.TypeRef;
import cosynth.diag.Location;

public record SignalDecl(
        String name,
        TypeRef type,
        Integer count,           // signal array size, null for a single signal
        Expr defaultValue,       // may be null
        Location loc
) {}
