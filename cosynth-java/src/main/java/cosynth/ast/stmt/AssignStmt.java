package cosynth.ast.stmt;

import cosynth.ast.expr.Expr;
import cosynth.diag.Location;
import cosynth.model.AssignMode;

public record AssignStmt(
        Expr target,
        AssignMode mode,
        Expr value,
        Location loc
) implements Stmt {}
