package cosynth.ast.stmt;

import cosynth.ast.expr.Expr;
import cosynth.diag.Location;

public record ExprStmt(
        Expr expr,
        Location loc
) implements Stmt {}
