package cosynth.ast.stmt;

import cosynth.ast.expr.Expr;
import cosynth.ast.type.TypeRef;
import cosynth.diag.Location;

public record VarDeclStmt(
        String name,
        TypeRef type,
        Expr initializer,        // reset value, may be null
        Location loc
) implements Stmt {}
