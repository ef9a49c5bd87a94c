package cosynth.ast.stmt;

import cosynth.diag.Location;

public sealed interface Stmt
        permits BlockStmt, IfStmt, WhileStmt, ForStmt,
        BreakStmt, ContinueStmt, ReturnStmt, AssertStmt, AwaitStmt,
        LetStmt, VarDeclStmt, AssignStmt, ExprStmt {

    Location loc();
}
