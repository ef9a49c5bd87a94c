package cosynth.ast.decl;

import cosynth.ast.stmt.BlockStmt;
import cosynth.diag.Location;
import cosynth.model.Clock;
import cosynth.model.ContextKind;

public record ContextDecl(
        String name,
        ContextKind kind,
        ClockSpec clock,         // null: no clock
        ResetSpec reset,         // null: no reset
        BlockStmt body,
        Location loc
) {
    public record ClockSpec(String signal, Clock.Edge edge, Long frequency) {}

    public record ResetSpec(String signal, boolean async, boolean activeLow) {}
}
