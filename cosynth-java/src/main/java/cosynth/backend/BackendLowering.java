package cosynth.backend;

import com.google.common.flogger.GoogleLogger;
import cosynth.fsm.State;
import cosynth.fsm.StateGraph;
import cosynth.ir.IrExpr;
import cosynth.ir.IrRewriter;
import cosynth.ir.IrStmt;
import cosynth.model.AssignMode;
import cosynth.model.Clock;
import cosynth.model.ConstantValue;
import cosynth.model.Reset;
import cosynth.model.Signal;
import cosynth.model.StorageObject;
import cosynth.model.Temporary;
import cosynth.model.Variable;
import cosynth.normalize.NormalizedContext;
import cosynth.sema.DesignRegistry;
import cosynth.settings.CompilerSettings;
import cosynth.settings.Configuration;
import cosynth.types.TypeUtil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives a {@link TargetBackend} with the compiled contexts of a design:
 * entity boundary, declarations, concurrent blocks, then processes.
 */
public final class BackendLowering {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final TargetBackend backend;
    private final String bufferSuffix;

    public BackendLowering(TargetBackend backend, Configuration config) {
        this.backend = backend;
        this.bufferSuffix = config.get(CompilerSettings.bufferSuffix);
    }

    public void lower(DesignRegistry registry, List<CompiledContext> contexts) {
        PortBuffering buffering = PortBuffering.plan(contexts, registry::allocateName, bufferSuffix);
        IrRewriter rewriter = buffering.rewriter();

        Map<String, Signal> stateSignals = new LinkedHashMap<>();
        for (CompiledContext ctx : contexts) {
            if (ctx.isSequential() && !ctx.graph().isSingleState()) {
                Signal state = Signal.generated(registry.allocateName(ctx.name() + "_state"),
                        TypeUtil.stateType(ctx.graph().size()), ConstantValue.of(0));
                stateSignals.put(ctx.name(), state);
            }
        }

        backend.emitEntityBoundary(registry.entity(), registry.ports());

        for (Signal s : registry.signals()) backend.emitDeclaration(s);
        for (Signal b : buffering.buffers().values()) backend.emitDeclaration(b);
        for (Signal s : stateSignals.values()) backend.emitDeclaration(s);
        for (CompiledContext ctx : contexts) {
            if (!ctx.isSequential()) {
                for (Temporary t : ctx.normalized().temporaries()) backend.emitDeclaration(t);
            }
        }

        for (CompiledContext ctx : contexts) {
            if (ctx.isSequential()) continue;
            List<IrStmt> body = rewriter.rewrite(ctx.normalized().body());
            backend.emitConcurrentBlock(ctx.name(), () -> statements(body, null));
        }
        for (Map.Entry<Signal, Signal> e : buffering.buffers().entrySet()) {
            Signal port = e.getKey();
            Signal buffer = e.getValue();
            backend.emitConcurrentBlock(buffer.name() + "_driver",
                    () -> backend.emitAssignment(port, new IrExpr.Ref(buffer), AssignMode.NEXT));
        }

        for (CompiledContext ctx : contexts) {
            if (ctx.isSequential() && ctx.graph().isSingleState()) process(ctx, null, buffering, rewriter);
        }
        for (CompiledContext ctx : contexts) {
            Signal state = stateSignals.get(ctx.name());
            if (state != null) process(ctx, state, buffering, rewriter);
        }
        logger.atInfo().log("lowered %s: %d contexts, %d buffered ports", registry.entity(),
                contexts.size(), buffering.buffers().size());
    }

    private void process(CompiledContext ctx, Signal state, PortBuffering buffering, IrRewriter rewriter) {
        NormalizedContext n = ctx.normalized();
        StateGraph graph = ctx.graph();

        Map<Signal, AssignMode> drivers = new LinkedHashMap<>();
        ctx.record().drivers().forEach((s, mode) -> drivers.put(buffering.map(s), mode));

        List<StorageObject> locals = new ArrayList<>(n.variables());
        locals.addAll(n.temporaries());

        Runnable reset = n.reset() == null ? null : () -> {
            drivers.forEach((s, mode) -> {
                if (s.hasDefault()) backend.emitAssignment(s, new IrExpr.Const(s.defaultValue()), mode);
            });
            for (Variable v : n.variables()) {
                if (v.hasDefault()) backend.emitAssignment(v, new IrExpr.Const(v.defaultValue()), AssignMode.VALUE);
            }
            if (state != null) backend.emitAssignment(state, new IrExpr.Const(ConstantValue.of(0)), AssignMode.NEXT);
        };

        Runnable body = () -> {
            // pulses fall back to their default unless assigned this cycle
            drivers.forEach((s, mode) -> {
                if (mode == AssignMode.PUSH) backend.emitAssignment(s, new IrExpr.Const(s.defaultValue()), AssignMode.PUSH);
            });
            if (state == null) {
                statements(rewriter.rewrite(graph.initial().body()), null);
                return;
            }
            List<StateArm> arms = new ArrayList<>();
            for (State s : graph.states()) {
                List<IrStmt> stmts = rewriter.rewrite(s.body());
                arms.add(new StateArm(s.id(), () -> statements(stmts, state)));
            }
            backend.emitStateSelector(state, arms);
        };

        Clock clock = n.clock() == null ? null
                : new Clock(buffering.map(n.clock().signal()), n.clock().edge(), n.clock().frequency());
        Reset r = n.reset() == null ? null
                : new Reset(buffering.map(n.reset().signal()), n.reset().async(), n.reset().activeLow());
        backend.emitProcess(ctx.name(), clock, r, new ProcessBody(locals, reset, body));
    }

    /** @param state null in a single-state process, where transitions are dropped */
    private void statements(List<IrStmt> stmts, Signal state) {
        for (IrStmt s : stmts) {
            if (s instanceof IrStmt.Assign a) {
                backend.emitAssignment(a.target(), a.value(), a.mode());
            } else if (s instanceof IrStmt.If i) {
                boolean then = emitsAnything(i.thenBranch(), state);
                boolean otherwise = emitsAnything(i.elseBranch(), state);
                if (!then && !otherwise) continue;
                backend.emitConditional(i.condition(),
                        () -> statements(i.thenBranch(), state),
                        otherwise ? () -> statements(i.elseBranch(), state) : null);
            } else if (s instanceof IrStmt.Assert a) {
                backend.emitAssertion(a.condition(), a.message());
            } else if (s instanceof IrStmt.Goto g) {
                if (state != null) {
                    backend.emitAssignment(state, new IrExpr.Const(ConstantValue.of(g.target())), AssignMode.NEXT);
                }
            } else {
                throw new IllegalStateException("Cannot lower " + s);
            }
        }
    }

    private static boolean emitsAnything(List<IrStmt> stmts, Signal state) {
        for (IrStmt s : stmts) {
            if (s instanceof IrStmt.Goto) {
                if (state != null) return true;
            } else if (s instanceof IrStmt.If i) {
                if (emitsAnything(i.thenBranch(), state) || emitsAnything(i.elseBranch(), state)) return true;
            } else {
                return true;
            }
        }
        return false;
    }
}
