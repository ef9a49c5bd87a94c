package cosynth.ast.expr;

import java.util.List;

public record ListExpr(List<Expr> elements) implements Expr {}
