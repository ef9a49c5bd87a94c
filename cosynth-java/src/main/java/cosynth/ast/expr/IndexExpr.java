package cosynth.ast.expr;

public record IndexExpr(
        Expr target,
        Expr index
) implements Expr {}
