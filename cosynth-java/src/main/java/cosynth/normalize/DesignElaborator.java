package cosynth.normalize;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import cosynth.ast.DesignUnit;
import cosynth.ast.decl.ConstDecl;
import cosynth.ast.decl.FunctionDecl;
import cosynth.ast.decl.PortDecl;
import cosynth.ast.decl.SignalDecl;
import cosynth.ast.expr.Expr;
import cosynth.diag.CompileException;
import cosynth.diag.ErrorKind;
import cosynth.diag.Location;
import cosynth.model.Builtin;
import cosynth.model.ConstantValue;
import cosynth.model.Signal;
import cosynth.model.Value;
import cosynth.sema.DesignRegistry;
import cosynth.sema.ObjectModelResolver;
import cosynth.sema.TypeResolver;
import cosynth.types.Type;

/**
 * Declares the design scope: builtins, functions, constants, ports and
 * signals. Functions come first so constant initializers may call them.
 */
public final class DesignElaborator {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final DesignRegistry registry;
    private final ObjectModelResolver resolver;
    private final ControlFlowNormalizer normalizer;
    private final TypeResolver types = new TypeResolver();

    public DesignElaborator(DesignRegistry registry, ObjectModelResolver resolver, ControlFlowNormalizer normalizer) {
        this.registry = registry;
        this.resolver = resolver;
        this.normalizer = normalizer;
    }

    public void elaborate(DesignUnit unit) {
        for (Builtin b : Builtin.values()) {
            resolver.bind(registry.builtinScope(), b.label(), new ConstantValue.BuiltinValue(b), Location.UNKNOWN);
        }
        for (FunctionDecl fn : unit.functions()) {
            resolver.bind(registry.designScope(), fn.name(), new ConstantValue.FunctionValue(fn), fn.loc());
            registry.reserve(fn.name());
        }
        for (ConstDecl c : unit.constants()) {
            ConstantValue v = normalizer.evaluateConstant(c.value(), c.loc());
            resolver.bind(registry.designScope(), c.name(), v, c.loc());
            registry.reserve(c.name());
        }
        for (PortDecl p : unit.ports()) {
            Type type = types.resolve(p.type(), p.loc());
            Signal port = Signal.port(p.name(), p.direction(), type, defaultOf(p.defaultValue(), p.loc()), p.loc());
            resolver.bind(registry.designScope(), p.name(), port, p.loc());
            registry.addPort(port);
        }
        for (SignalDecl s : unit.signals()) {
            declareSignal(s);
        }
        logger.atFine().log("design %s: %d ports, %d signals", unit.name(),
                registry.ports().size(), registry.signals().size());
    }

    private void declareSignal(SignalDecl s) {
        Type type = types.resolve(s.type(), s.loc());
        ConstantValue init = defaultOf(s.defaultValue(), s.loc());
        if (s.count() == null) {
            Signal signal = Signal.internal(s.name(), type, init, s.loc());
            resolver.bind(registry.designScope(), s.name(), signal, s.loc());
            registry.addSignal(signal);
            return;
        }
        if (s.count() <= 0) {
            throw new CompileException(ErrorKind.UNSUPPORTED_CONSTRUCT, s.loc(),
                    "Signal array '" + s.name() + "' needs a positive size");
        }
        // regs[4] declares regs_0..regs_3; the array name binds a constant list of them
        ImmutableList.Builder<Value> elements = ImmutableList.builder();
        for (int i = 0; i < s.count(); i++) {
            Signal element = Signal.internal(s.name() + "_" + i, type, init, s.loc());
            registry.addSignal(element);
            elements.add(element);
        }
        resolver.bind(registry.designScope(), s.name(), new ConstantValue.ListValue(elements.build()), s.loc());
        registry.reserve(s.name());
    }

    private ConstantValue defaultOf(Expr e, Location at) {
        if (e == null) return null;
        ConstantValue v = normalizer.evaluateConstant(e, at);
        if (!(v instanceof ConstantValue.IntValue) && !(v instanceof ConstantValue.BoolValue)) {
            throw new CompileException(ErrorKind.UNSUPPORTED_CONSTRUCT, at,
                    "Default value " + v + " has no hardware representation");
        }
        return v;
    }
}
