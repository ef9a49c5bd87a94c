package cosynth.ast.stmt;

import cosynth.ast.expr.Expr;
import cosynth.diag.Location;

public record LetStmt(
        String name,
        Expr value,
        Location loc
) implements Stmt {}
