package cosynth.sema;

import com.google.common.flogger.GoogleLogger;
import cosynth.diag.CompileException;
import cosynth.diag.ErrorKind;
import cosynth.diag.Location;
import cosynth.ir.IrStmt;
import cosynth.ir.IrWalker;
import cosynth.model.AssignMode;
import cosynth.model.ConstantValue;
import cosynth.model.PortDirection;
import cosynth.model.Signal;
import cosynth.model.StorageObject;
import cosynth.model.Temporary;
import cosynth.model.Value;
import cosynth.model.Variable;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Classifies bindings and enforces the assignment discipline of the storage
 * classes. Per-context effects are staged in a {@link ContextRecord} and only
 * reach the registry through {@link #commit}.
 */
public final class ObjectModelResolver {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final DesignRegistry registry;

    public ObjectModelResolver(DesignRegistry registry) {
        this.registry = registry;
    }

    public static BindingKind classify(Value value) {
        if (value instanceof Signal s) return s.isPort() ? BindingKind.PORT : BindingKind.SIGNAL;
        if (value instanceof Variable) return BindingKind.VARIABLE;
        if (value instanceof Temporary) return BindingKind.TEMPORARY;
        return BindingKind.CONSTANT;
    }

    public Binding bind(Scope scope, String name, Value value, Location at) {
        Binding b = new Binding(name, value, classify(value), at);
        scope.define(b);
        return b;
    }

    public Binding bind(SymbolTable table, String name, Value value, Location at) {
        Binding b = new Binding(name, value, classify(value), at);
        table.define(b);
        return b;
    }

    public void checkVariableDeclaration(ContextRecord ctx, String name, Location at) {
        if (!ctx.isSequential()) {
            throw new CompileException(ErrorKind.INVALID_ASSIGNMENT_MODE, at,
                    "Variable '" + name + "' declared outside a sequential context");
        }
    }

    public void checkAssignment(ContextRecord ctx, Value target, AssignMode mode, Location at) {
        if (target instanceof ConstantValue) {
            throw invalid(at, "Cannot assign to constant value " + target);
        }
        if (target instanceof Temporary t) {
            throw invalid(at, "Cannot assign to temporary " + t.name());
        }
        if (target instanceof Variable v) {
            if (!ctx.isSequential()) {
                throw invalid(at, "Variable '" + v.name() + "' assigned outside a sequential context");
            }
            if (mode != AssignMode.VALUE) {
                throw invalid(at, "Variable '" + v.name() + "' must be assigned with @=, not " + mode.symbol());
            }
            return;
        }

        Signal s = (Signal) target;
        if (mode == AssignMode.VALUE) {
            throw invalid(at, "Signal '" + s.name() + "' cannot be assigned with @=");
        }
        if (s.isPort() && s.direction() == PortDirection.IN) {
            throw invalid(at, "Input port '" + s.name() + "' cannot be written");
        }
        if (mode == AssignMode.PUSH) {
            if (!ctx.isSequential()) {
                throw invalid(at, "^= is not allowed in concurrent context '" + ctx.name() + "'");
            }
            if (!s.hasDefault()) {
                throw invalid(at, "Signal '" + s.name() + "' needs a default value to be assigned with ^=");
            }
        }

        AssignMode previous = ctx.modeOf(s);
        if (previous == null) previous = registry.committedMode(s);
        if (previous != null && previous != mode) {
            throw invalid(at, "Signal '" + s.name() + "' is assigned with both " + previous.symbol()
                    + " and " + mode.symbol());
        }
        ctx.recordDriver(s, mode);
    }

    public void recordRead(ContextRecord ctx, StorageObject object) {
        if (object instanceof Signal s && s.isPort() && s.direction() == PortDirection.OUT) {
            ctx.recordOutputRead(s);
        }
    }

    /**
     * Re-checks assignment legality over synthesized state bodies, where code
     * may have been duplicated. Definitions of named temporaries are
     * compiler-generated and exempt.
     */
    public void revalidate(ContextRecord ctx, List<List<IrStmt>> bodies) {
        for (List<IrStmt> body : bodies) {
            IrWalker.statements(body, s -> {
                if (s instanceof IrStmt.Assign a) {
                    if (a.target() instanceof Temporary t && t.isMaterialized()) return;
                    checkAssignment(ctx, a.target(), a.mode(), a.loc());
                } else if (s instanceof IrStmt.While || s instanceof IrStmt.Await
                        || s instanceof IrStmt.Break || s instanceof IrStmt.Continue) {
                    throw new IllegalStateException("Control statement left in a state body of " + ctx.name());
                }
            });
        }
    }

    public void commit(ContextRecord ctx) {
        registry.commit(ctx);
        logger.atFine().log("committed context %s driving %s", ctx.name(), ctx.drivers().keySet());
    }

    /** Signals driven by more than one committed context. */
    public Map<Signal, Collection<String>> driverConflicts() {
        DriverRegistry drivers = new DriverRegistry();
        for (ContextRecord ctx : registry.committedContexts()) {
            drivers.commit(ctx);
        }
        return drivers.conflicts();
    }

    private static CompileException invalid(Location at, String message) {
        return new CompileException(ErrorKind.INVALID_ASSIGNMENT_MODE, at, message);
    }
}
