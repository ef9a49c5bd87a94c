package cosynth.ast.stmt;

import cosynth.ast.expr.Expr;
import cosynth.diag.Location;

public record ReturnStmt(
        Expr value,              // null for a bare return
        Location loc
) implements Stmt {}
