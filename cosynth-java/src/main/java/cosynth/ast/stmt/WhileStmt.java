package cosynth.ast.stmt;

import cosynth.ast.expr.Expr;
import cosynth.diag.Location;

public record WhileStmt(
        Expr condition,
        BlockStmt body,
        Location loc
) implements Stmt {}
