package cosynth.fsm;

import com.google.common.collect.ImmutableList;
import cosynth.diag.Location;
import cosynth.ir.IrStmt;

import java.util.List;

/**
 * One automaton node. Every path through the body ends in a {@code Goto} or
 * falls through, which holds the current state.
 */
public record State(int id, List<IrStmt> body, boolean waiting, Location origin) {
    public State {
        body = ImmutableList.copyOf(body);
    }
}
