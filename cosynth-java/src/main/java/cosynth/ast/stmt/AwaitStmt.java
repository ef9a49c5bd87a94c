package cosynth.ast.stmt;

import cosynth.ast.expr.Expr;
import cosynth.diag.Location;

public record AwaitStmt(
        Expr awaited,
        Location loc
) implements Stmt {}
