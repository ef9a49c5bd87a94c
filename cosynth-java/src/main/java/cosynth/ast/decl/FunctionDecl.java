package cosynth.ast.decl;

import cosynth.ast.expr.Expr;
import cosynth.ast.stmt.BlockStmt;
import cosynth.diag.Location;

import java.util.List;

public record FunctionDecl(
        String name,
        List<Param> params,
        BlockStmt body,
        boolean coroutine,       // declared `async fn`
        Location loc
) {
    public enum ParamKind { POSITIONAL, REST, KEYWORD_REST }

    public record Param(String name, ParamKind kind, Expr defaultValue) {}
}
