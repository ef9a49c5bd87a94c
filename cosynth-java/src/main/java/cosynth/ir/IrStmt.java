package cosynth.ir;

import com.google.common.collect.ImmutableList;
import cosynth.diag.Location;
import cosynth.model.AssignMode;
import cosynth.model.StorageObject;

import java.util.List;

/**
 * Flattened statement form shared by the normalizer, the state-machine
 * synthesizer and the backend lowering. Lists are immutable; positions inside
 * them are identified by list identity (see {@code cosynth.fsm.Cursor}).
 */
public sealed interface IrStmt
        permits IrStmt.Assign, IrStmt.If, IrStmt.While, IrStmt.Break, IrStmt.Continue,
        IrStmt.Await, IrStmt.Assert, IrStmt.Goto {

    Location loc();

    record Assign(StorageObject target, IrExpr value, AssignMode mode, Location loc) implements IrStmt {}

    /** Runtime branch. Constant branches never reach the IR. */
    record If(IrExpr condition, List<IrStmt> thenBranch, List<IrStmt> elseBranch, Location loc) implements IrStmt {
        public If {
            thenBranch = ImmutableList.copyOf(thenBranch);
            elseBranch = ImmutableList.copyOf(elseBranch);
        }
    }

    /** Suspending loop: every iteration costs at least one clock cycle. */
    record While(IrExpr condition, List<IrStmt> body, Location loc) implements IrStmt {
        public While {
            body = ImmutableList.copyOf(body);
        }
    }

    record Break(Location loc) implements IrStmt {}

    record Continue(Location loc) implements IrStmt {}

    /** Primitive suspension until the condition holds. */
    record Await(IrExpr condition, Location loc) implements IrStmt {}

    record Assert(IrExpr condition, String message, Location loc) implements IrStmt {}

    /** Next-state selection; only present in synthesized state bodies. */
    record Goto(int target) implements IrStmt {
        @Override
        public Location loc() {
            return Location.UNKNOWN;
        }
    }
}
