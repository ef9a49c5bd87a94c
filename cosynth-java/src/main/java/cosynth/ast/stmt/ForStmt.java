package cosynth.ast.stmt;

import cosynth.ast.expr.Expr;
import cosynth.diag.Location;

import java.util.List;

public record ForStmt(
        List<String> names,      // more than one name unpacks each element
        Expr iterable,
        BlockStmt body,
        BlockStmt elseBlock,     // fallback, may be null
        Location loc
) implements Stmt {}
