package cosynth.ast.expr;

// from...to, upper bound exclusive
public record RangeExpr(
        Expr from,
        Expr to
) implements Expr {}
