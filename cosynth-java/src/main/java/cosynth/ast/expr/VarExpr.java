package cosynth.ast.expr;

public record VarExpr(String name) implements Expr {}
