package cosynth.ast.stmt;

import cosynth.ast.expr.Expr;
import cosynth.diag.Location;

public record AssertStmt(
        Expr condition,
        String message,          // may be null
        Location loc
) implements Stmt {}
