package cosynth.ast.expr;

public sealed interface Expr
        permits IntLiteral, BoolLiteral, StringLiteral,
        VarExpr, BinaryExpr, UnaryExpr, CallExpr,
        IndexExpr, ListExpr, RangeExpr {}
