package cosynth.ast.stmt;

import cosynth.diag.Location;

public record BreakStmt(Location loc) implements Stmt {}
