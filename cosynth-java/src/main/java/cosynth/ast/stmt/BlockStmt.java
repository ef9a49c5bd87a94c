package cosynth.ast.stmt;

import cosynth.diag.Location;

import java.util.List;

public record BlockStmt(
        List<Stmt> statements,
        Location loc
) implements Stmt {}
