package cosynth.ast.expr;

public record StringLiteral(String value) implements Expr {}
