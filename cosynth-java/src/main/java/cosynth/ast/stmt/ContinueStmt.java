package cosynth.ast.stmt;

import cosynth.diag.Location;

public record ContinueStmt(Location loc) implements Stmt {}
