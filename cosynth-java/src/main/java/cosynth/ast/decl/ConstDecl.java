package cosynth.ast.decl;

import cosynth.ast.expr.Expr;
import cosynth.diag.Location;

public record ConstDecl(
        String name,
        Expr value,
        Location loc
) {}
