package cosynth.backend;

import com.google.common.collect.ImmutableList;
import cosynth.diag.CompileException;
import cosynth.diag.Diagnostic;
import cosynth.diag.ErrorKind;
import cosynth.fsm.State;
import cosynth.fsm.StateGraph;
import cosynth.ir.IrStmt;
import cosynth.ir.IrWalker;
import cosynth.model.StorageObject;
import cosynth.model.Temporary;
import cosynth.normalize.NormalizedContext;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * A named temporary is computed by a process-local assignment, so a state
 * that reads it before computing it sees the value left by an earlier cycle.
 */
public final class TemporaryLifetimeCheck {
    private final boolean strict;

    public TemporaryLifetimeCheck(boolean strict) {
        this.strict = strict;
    }

    /**
     * @return one warning per offending temporary
     * @throws CompileException in strict mode
     */
    public List<Diagnostic> check(NormalizedContext ctx, StateGraph graph) {
        if (graph == null || graph.isSingleState()) return List.of();
        ImmutableList.Builder<Diagnostic> warnings = ImmutableList.builder();
        for (Temporary t : ctx.temporaries()) {
            Set<Integer> computing = new TreeSet<>();
            Set<Integer> stale = new TreeSet<>();
            for (State s : graph.states()) {
                boolean[] computed = {false};
                Consumer<StorageObject> read = o -> {
                    if (o == t && !computed[0]) stale.add(s.id());
                };
                IrWalker.statements(s.body(), stmt -> {
                    if (stmt instanceof IrStmt.Assign a) {
                        IrWalker.reads(a.value(), read);
                        if (a.target() == t) {
                            computed[0] = true;
                            computing.add(s.id());
                        }
                    } else if (stmt instanceof IrStmt.If i) {
                        IrWalker.reads(i.condition(), read);
                    } else if (stmt instanceof IrStmt.Assert a) {
                        IrWalker.reads(a.condition(), read);
                    }
                });
            }
            if (stale.isEmpty()) continue;

            String message = "Temporary '" + t.name() + "' is read in state(s) " + stale
                    + " before it is computed there; computed in state(s) " + computing;
            if (strict) {
                throw new CompileException(ErrorKind.UNSUPPORTED_CONSTRUCT, t.declaredAt(), message);
            }
            warnings.add(Diagnostic.warning(ErrorKind.TEMPORARY_ACROSS_STATES, ctx.name(), t.declaredAt(), message));
        }
        return warnings.build();
    }
}
