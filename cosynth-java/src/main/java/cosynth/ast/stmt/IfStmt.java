package cosynth.ast.stmt;

import cosynth.ast.expr.Expr;
import cosynth.diag.Location;

public record IfStmt(
        Expr condition,
        BlockStmt thenBlock,
        BlockStmt elseBlock,     // null when absent; `else if` is nested here
        Location loc
) implements Stmt {}
