package cosynth.ast.expr;

public record IntLiteral(long value) implements Expr {}
