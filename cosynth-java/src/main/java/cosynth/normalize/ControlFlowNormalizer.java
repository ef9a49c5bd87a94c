package cosynth.normalize;

import com.google.common.flogger.GoogleLogger;
import com.google.common.flogger.LazyArgs;
import cosynth.ast.decl.ContextDecl;
import cosynth.ast.decl.FunctionDecl;
import cosynth.ast.expr.*;
import cosynth.ast.stmt.*;
import cosynth.diag.CompileException;
import cosynth.diag.ErrorKind;
import cosynth.diag.Location;
import cosynth.ir.IrExpr;
import cosynth.ir.IrPrinter;
import cosynth.ir.IrStmt;
import cosynth.model.AssignMode;
import cosynth.model.Clock;
import cosynth.model.ConstantValue;
import cosynth.model.ConstantValue.BoolValue;
import cosynth.model.ConstantValue.IntValue;
import cosynth.model.ConstantValue.ListValue;
import cosynth.model.ContextKind;
import cosynth.model.Reset;
import cosynth.model.Signal;
import cosynth.model.StorageObject;
import cosynth.model.Temporary;
import cosynth.model.Value;
import cosynth.model.Variable;
import cosynth.sema.Binding;
import cosynth.sema.ContextRecord;
import cosynth.sema.DesignRegistry;
import cosynth.sema.ObjectModelResolver;
import cosynth.sema.SymbolTable;
import cosynth.sema.TypeResolver;
import cosynth.settings.CompilerSettings;
import cosynth.settings.Configuration;
import cosynth.types.PrimitiveType;
import cosynth.types.Type;
import cosynth.types.TypeUtil;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Traces a context body once and flattens it: constant branches are resolved,
 * {@code for} loops unrolled, calls inlined and coroutine awaits spliced. Only
 * runtime branches and suspending constructs are left for the state-machine
 * synthesizer.
 */
public final class ControlFlowNormalizer {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private enum LoopKind { UNROLLED, SUSPENDING }

    /** Lexical frame of the context body or of one inlined call. */
    private static final class Frame {
        final SymbolTable symbols;
        final int depth;
        final boolean function;
        final Deque<LoopKind> loops = new ArrayDeque<>();
        int runtimeNesting;
        Value returnValue = ConstantValue.NoneValue.INSTANCE;
        boolean returned;

        Frame(SymbolTable symbols, int depth, boolean function) {
            this.symbols = symbols;
            this.depth = depth;
            this.function = function;
        }
    }

    private final DesignRegistry registry;
    private final ObjectModelResolver resolver;
    private final TypeResolver types = new TypeResolver();
    private final int maxInlineDepth;
    private final int maxUnroll;

    private ContextRecord ctx;
    private List<Variable> variables;
    private List<Temporary> temporaries;

    public ControlFlowNormalizer(DesignRegistry registry, ObjectModelResolver resolver, Configuration config) {
        this.registry = registry;
        this.resolver = resolver;
        this.maxInlineDepth = config.get(CompilerSettings.maxInlineDepth);
        this.maxUnroll = config.get(CompilerSettings.maxUnroll);
    }

    public NormalizedContext normalize(ContextDecl decl, ContextRecord record) {
        this.ctx = record;
        this.variables = new ArrayList<>();
        this.temporaries = new ArrayList<>();

        Clock clock = null;
        if (decl.clock() != null) {
            Signal s = signalNamed(decl.clock().signal(), decl.loc());
            clock = new Clock(s, decl.clock().edge(), decl.clock().frequency());
        }
        Reset reset = null;
        if (decl.reset() != null) {
            Signal s = signalNamed(decl.reset().signal(), decl.loc());
            reset = new Reset(s, decl.reset().async(), decl.reset().activeLow());
        }

        Frame root = new Frame(new SymbolTable(registry.designScope()), 0, false);
        List<IrStmt> out = new ArrayList<>();
        block(decl.body(), root, out);

        logger.atFine().log("normalized %s:\n%s", decl.name(), LazyArgs.lazy(() -> IrPrinter.print(out)));
        return new NormalizedContext(decl.name(), decl.kind(), clock, reset, out, variables, temporaries, decl.loc());
    }

    /** Evaluates a design-level initializer, which must fold to a constant. */
    public ConstantValue evaluateConstant(Expr e, Location at) {
        ContextRecord saved = ctx;
        List<Variable> savedVariables = variables;
        List<Temporary> savedTemporaries = temporaries;
        this.ctx = new ContextRecord("<design>", ContextKind.CONCURRENT, false);
        this.variables = new ArrayList<>();
        this.temporaries = new ArrayList<>();
        try {
            List<IrStmt> out = new ArrayList<>();
            Value v = eval(e, new Frame(new SymbolTable(registry.designScope()), 0, false), out, at);
            if (!out.isEmpty() || !(v instanceof ConstantValue)) {
                throw unsupported(at, "Initializer is not a compile-time constant");
            }
            return (ConstantValue) v;
        } finally {
            this.ctx = saved;
            this.variables = savedVariables;
            this.temporaries = savedTemporaries;
        }
    }

    // ---------- statements ----------

    private void block(BlockStmt b, Frame f, List<IrStmt> out) {
        f.symbols.push();
        for (Stmt s : b.statements()) {
            stmt(s, f, out);
            if (f.returned) break;
        }
        f.symbols.pop();
    }

    private void stmt(Stmt s, Frame f, List<IrStmt> out) {
        if (s instanceof BlockStmt b) {
            block(b, f, out);
        } else if (s instanceof LetStmt l) {
            let(l, f, out);
        } else if (s instanceof VarDeclStmt v) {
            varDecl(v, f, out);
        } else if (s instanceof AssignStmt a) {
            assign(a, f, out);
        } else if (s instanceof ExprStmt e) {
            if (!(e.expr() instanceof CallExpr)) {
                throw unsupported(e.loc(), "Expression statement has no effect");
            }
            eval(e.expr(), f, out, e.loc());
        } else if (s instanceof IfStmt i) {
            ifStmt(i, f, out);
        } else if (s instanceof WhileStmt w) {
            whileStmt(w, f, out);
        } else if (s instanceof ForStmt fs) {
            forStmt(fs, f, out);
        } else if (s instanceof BreakStmt br) {
            loopControl(f, br.loc(), "break");
            out.add(new IrStmt.Break(br.loc()));
        } else if (s instanceof ContinueStmt c) {
            loopControl(f, c.loc(), "continue");
            out.add(new IrStmt.Continue(c.loc()));
        } else if (s instanceof ReturnStmt r) {
            returnStmt(r, f, out);
        } else if (s instanceof AssertStmt a) {
            assertStmt(a, f, out);
        } else if (s instanceof AwaitStmt a) {
            await(a, f, out);
        } else {
            throw unsupported(s.loc(), "Unsupported statement " + s.getClass().getSimpleName());
        }
    }

    private void let(LetStmt s, Frame f, List<IrStmt> out) {
        Value v = eval(s.value(), f, out, s.loc());
        if (v instanceof Temporary t && !t.isMaterialized()) {
            t.materialize(registry.allocateName(s.name()));
            temporaries.add(t);
            AssignMode mode = ctx.isSequential() ? AssignMode.VALUE : AssignMode.NEXT;
            out.add(new IrStmt.Assign(t, t.expr(), mode, s.loc()));
        }
        // storage objects are aliased, never copied
        resolver.bind(f.symbols, s.name(), v, s.loc());
    }

    private void varDecl(VarDeclStmt s, Frame f, List<IrStmt> out) {
        resolver.checkVariableDeclaration(ctx, s.name(), s.loc());
        Type type = types.resolve(s.type(), s.loc());
        ConstantValue reset = null;
        if (s.initializer() != null) {
            reset = hardwareConstant(eval(s.initializer(), f, out, s.loc()), s.loc(),
                    "Initializer of variable '" + s.name() + "'");
        }
        Variable var = new Variable(registry.allocateName(s.name()), type, reset, ctx.name(), s.loc());
        variables.add(var);
        resolver.bind(f.symbols, s.name(), var, s.loc());
    }

    private void assign(AssignStmt s, Frame f, List<IrStmt> out) {
        Value target = eval(s.target(), f, out, s.loc());
        if (s.target() instanceof IndexExpr && target instanceof Temporary) {
            throw unsupported(s.loc(), "Assignment to a bit select is not supported");
        }
        resolver.checkAssignment(ctx, target, s.mode(), s.loc());
        Value value = eval(s.value(), f, out, s.loc());
        out.add(new IrStmt.Assign((StorageObject) target, ir(value, s.loc()), s.mode(), s.loc()));
    }

    private void ifStmt(IfStmt s, Frame f, List<IrStmt> out) {
        Value c = eval(s.condition(), f, out, s.loc());
        if (c instanceof ConstantValue cv) {
            // the branch not taken is never traced
            if (ConstantFolder.truthy(cv)) {
                block(s.thenBlock(), f, out);
            } else if (s.elseBlock() != null) {
                block(s.elseBlock(), f, out);
            }
            return;
        }
        requireRuntimeBranching(s.loc());
        IrExpr cond = ir(c, s.loc());

        f.runtimeNesting++;
        List<IrStmt> thenOut = new ArrayList<>();
        block(s.thenBlock(), f, thenOut);
        List<IrStmt> elseOut = new ArrayList<>();
        if (s.elseBlock() != null) block(s.elseBlock(), f, elseOut);
        f.runtimeNesting--;

        out.add(new IrStmt.If(cond, thenOut, elseOut, s.loc()));
    }

    private void whileStmt(WhileStmt s, Frame f, List<IrStmt> out) {
        Value c = eval(s.condition(), f, out, s.loc());
        if (c instanceof ConstantValue cv && !ConstantFolder.truthy(cv)) return;
        requireSuspension(s.loc(), "while");
        IrExpr cond = c instanceof ConstantValue ? IrExpr.ALWAYS : ir(c, s.loc());

        f.loops.push(LoopKind.SUSPENDING);
        f.runtimeNesting++;
        List<IrStmt> body = new ArrayList<>();
        block(s.body(), f, body);
        f.runtimeNesting--;
        f.loops.pop();

        out.add(new IrStmt.While(cond, body, s.loc()));
    }

    private void forStmt(ForStmt s, Frame f, List<IrStmt> out) {
        Value it = eval(s.iterable(), f, out, s.loc());
        if (!(it instanceof ListValue list)) {
            throw unsupported(s.loc(), "for loop needs a compile-time list, got " + it);
        }
        if (list.size() > maxUnroll) {
            throw unsupported(s.loc(), "for loop over " + list.size() + " elements exceeds max-unroll " + maxUnroll);
        }
        if (isFirstMatch(s)) {
            firstMatch(s, list, f, out);
            return;
        }

        f.loops.push(LoopKind.UNROLLED);
        for (Value element : list.elements()) {
            f.symbols.push();
            bindLoopNames(s, element, f);
            block(s.body(), f, out);
            f.symbols.pop();
            if (f.returned) break;
        }
        f.loops.pop();

        if (!f.returned && s.elseBlock() != null) {
            block(s.elseBlock(), f, out);
        }
    }

    /** Body is a single else-less {@code if} whose block ends in {@code break}. */
    private static boolean isFirstMatch(ForStmt s) {
        List<Stmt> body = s.body().statements();
        if (body.size() != 1 || !(body.get(0) instanceof IfStmt guard) || guard.elseBlock() != null) return false;
        List<Stmt> then = guard.thenBlock().statements();
        return !then.isEmpty() && then.get(then.size() - 1) instanceof BreakStmt;
    }

    private void firstMatch(ForStmt s, ListValue list, Frame f, List<IrStmt> out) {
        IfStmt guard = (IfStmt) s.body().statements().get(0);
        List<Stmt> armStmts = guard.thenBlock().statements();
        BlockStmt arm = new BlockStmt(armStmts.subList(0, armStmts.size() - 1), guard.thenBlock().loc());

        // per runtime arm: the code computing its guard, the guard, the arm body
        List<List<IrStmt>> guards = new ArrayList<>();
        List<IrExpr> conditions = new ArrayList<>();
        List<List<IrStmt>> bodies = new ArrayList<>();
        // guard code that runs only once every earlier runtime guard was false
        List<IrStmt> pending = new ArrayList<>();
        List<IrStmt> fallback = null;

        f.loops.push(LoopKind.UNROLLED);
        for (Value element : list.elements()) {
            f.symbols.push();
            bindLoopNames(s, element, f);
            boolean guarded = !conditions.isEmpty();
            if (guarded) f.runtimeNesting++;
            Value c = eval(guard.condition(), f, pending, guard.loc());
            if (guarded) f.runtimeNesting--;
            if (c instanceof ConstantValue cv) {
                if (ConstantFolder.truthy(cv)) {
                    fallback = pending;
                    armUnder(conditions, arm, f, fallback);
                    f.symbols.pop();
                    break;
                }
                f.symbols.pop();
                continue;
            }
            requireRuntimeBranching(guard.loc());
            guards.add(pending);
            conditions.add(ir(c, guard.loc()));
            List<IrStmt> body = new ArrayList<>();
            f.runtimeNesting++;
            block(arm, f, body);
            f.runtimeNesting--;
            bodies.add(body);
            pending = new ArrayList<>();
            f.symbols.pop();
        }
        f.loops.pop();

        if (fallback == null) {
            fallback = pending;
            if (s.elseBlock() != null) armUnder(conditions, s.elseBlock(), f, fallback);
        }

        List<IrStmt> chain = fallback;
        for (int i = conditions.size() - 1; i >= 0; i--) {
            List<IrStmt> link = new ArrayList<>(guards.get(i));
            link.add(new IrStmt.If(conditions.get(i), bodies.get(i), chain, guard.loc()));
            chain = link;
        }
        out.addAll(chain);
    }

    /** The chain's final else sits under every runtime condition before it. */
    private void armUnder(List<IrExpr> conditions, BlockStmt b, Frame f, List<IrStmt> out) {
        boolean guarded = !conditions.isEmpty();
        if (guarded) f.runtimeNesting++;
        block(b, f, out);
        if (guarded) f.runtimeNesting--;
    }

    private void bindLoopNames(ForStmt s, Value element, Frame f) {
        List<String> names = s.names();
        if (names.size() == 1) {
            resolver.bind(f.symbols, names.get(0), element, s.loc());
            return;
        }
        if (!(element instanceof ListValue tuple) || tuple.size() != names.size()) {
            throw unsupported(s.loc(), "Cannot unpack " + element + " into " + names);
        }
        for (int i = 0; i < names.size(); i++) {
            resolver.bind(f.symbols, names.get(i), tuple.elements().get(i), s.loc());
        }
    }

    private void loopControl(Frame f, Location at, String keyword) {
        if (f.loops.isEmpty()) {
            throw unsupported(at, "'" + keyword + "' outside a loop");
        }
        if (f.loops.peek() == LoopKind.UNROLLED) {
            throw unsupported(at, "'" + keyword + "' in an unrolled for loop is only supported as a first-match search");
        }
    }

    private void returnStmt(ReturnStmt s, Frame f, List<IrStmt> out) {
        if (!f.function) {
            throw unsupported(s.loc(), "'return' outside a function");
        }
        if (f.runtimeNesting > 0) {
            throw unsupported(s.loc(), "'return' under a runtime condition or inside a suspending loop");
        }
        f.returnValue = s.value() == null ? ConstantValue.NoneValue.INSTANCE : eval(s.value(), f, out, s.loc());
        f.returned = true;
    }

    private void assertStmt(AssertStmt s, Frame f, List<IrStmt> out) {
        Value c = eval(s.condition(), f, out, s.loc());
        if (c instanceof ConstantValue cv) {
            if (!ConstantFolder.truthy(cv)) {
                throw new CompileException(ErrorKind.COMPILE_TIME_ASSERTION, s.loc(),
                        s.message() == null ? "Assertion failed" : s.message());
            }
            return;
        }
        out.add(new IrStmt.Assert(ir(c, s.loc()), s.message(), s.loc()));
    }

    private void await(AwaitStmt s, Frame f, List<IrStmt> out) {
        requireSuspension(s.loc(), "await");
        Value v;
        if (s.awaited() instanceof CallExpr call) {
            Value callee = eval(call.callee(), f, out, s.loc());
            if (callee instanceof ConstantValue.FunctionValue fn && fn.decl().coroutine()) {
                // the coroutine's own suspension points become ours
                inline(fn.decl(), arguments(call, f, out, s.loc()), f, out, s.loc());
                return;
            }
            v = apply(callee, call, f, out, s.loc());
        } else {
            v = eval(s.awaited(), f, out, s.loc());
        }
        IrExpr cond = v instanceof ConstantValue cv
                ? new IrExpr.Const(BoolValue.of(ConstantFolder.truthy(cv)))
                : ir(v, s.loc());
        out.add(new IrStmt.Await(cond, s.loc()));
    }

    // ---------- calls ----------

    private Value apply(Value callee, CallExpr call, Frame f, List<IrStmt> out, Location at) {
        if (callee instanceof ConstantValue.BuiltinValue b) {
            return Builtins.apply(b.builtin(), arguments(call, f, out, at), maxUnroll, at);
        }
        if (callee instanceof ConstantValue.FunctionValue fn) {
            if (fn.decl().coroutine()) {
                throw unsupported(at, "Coroutine '" + fn.decl().name() + "' must be called with await");
            }
            return inline(fn.decl(), arguments(call, f, out, at), f, out, at);
        }
        throw unsupported(at, callee + " is not callable");
    }

    private Value inline(FunctionDecl fn, CallArguments args, Frame caller, List<IrStmt> out, Location at) {
        int depth = caller.depth + 1;
        if (depth > maxInlineDepth) {
            throw new CompileException(ErrorKind.UNBOUNDED_RECURSION, at,
                    "Inlining '" + fn.name() + "' exceeds the maximum depth of " + maxInlineDepth);
        }
        Map<String, Value> params = ArgumentBinder.bind(fn, args,
                e -> eval(e, new Frame(new SymbolTable(registry.designScope()), caller.depth, false), out, at), at);

        // lexical scoping: the callee sees the design scope, not the caller's locals
        Frame callee = new Frame(new SymbolTable(registry.designScope()), depth, true);
        for (Map.Entry<String, Value> p : params.entrySet()) {
            resolver.bind(callee.symbols, p.getKey(), p.getValue(), fn.loc());
        }
        block(fn.body(), callee, out);
        return callee.returnValue;
    }

    private CallArguments arguments(CallExpr call, Frame f, List<IrStmt> out, Location at) {
        List<Value> positional = new ArrayList<>();
        Map<String, Value> keywords = new LinkedHashMap<>();
        for (CallExpr.Argument a : call.args()) {
            Value v = eval(a.value(), f, out, at);
            switch (a.kind()) {
                case POSITIONAL -> positional.add(v);
                case KEYWORD -> putKeyword(keywords, a.keyword(), v, at);
                case SPREAD -> {
                    if (!(v instanceof ListValue l)) throw unsupported(at, "Cannot spread " + v + " as positional arguments");
                    positional.addAll(l.elements());
                }
                case KEYWORD_SPREAD -> {
                    if (!(v instanceof ConstantValue.DictValue d)) throw unsupported(at, "Cannot spread " + v + " as keyword arguments");
                    d.entries().forEach((k, kv) -> putKeyword(keywords, k, kv, at));
                }
            }
        }
        return new CallArguments(positional, keywords);
    }

    private static void putKeyword(Map<String, Value> keywords, String name, Value v, Location at) {
        if (keywords.put(name, v) != null) {
            throw unsupported(at, "Keyword argument '" + name + "' given more than once");
        }
    }

    // ---------- expressions ----------

    private Value eval(Expr e, Frame f, List<IrStmt> out, Location at) {
        if (e instanceof IntLiteral i) return ConstantValue.of(i.value());
        if (e instanceof BoolLiteral b) return BoolValue.of(b.value());
        if (e instanceof StringLiteral s) return new ConstantValue.StringValue(s.value());

        if (e instanceof VarExpr v) {
            Binding b = f.symbols.lookup(v.name());
            if (b == null) throw unsupported(at, "Undefined name '" + v.name() + "'");
            return b.value();
        }
        if (e instanceof ListExpr l) {
            List<Value> elements = new ArrayList<>();
            for (Expr el : l.elements()) elements.add(eval(el, f, out, at));
            return new ListValue(elements);
        }
        if (e instanceof RangeExpr r) {
            Value from = eval(r.from(), f, out, at);
            Value to = eval(r.to(), f, out, at);
            if (!(from instanceof IntValue a) || !(to instanceof IntValue b)) {
                throw unsupported(at, "Range bounds must be constant integers");
            }
            return Builtins.ints(a.value(), b.value(), 1, maxUnroll, at);
        }
        if (e instanceof UnaryExpr u) {
            Value v = eval(u.expr(), f, out, at);
            if (v instanceof ConstantValue c) return ConstantFolder.unary(u.op(), c, at);
            Type type = u.op() == UnaryExpr.Operator.NOT ? PrimitiveType.BOOL : typeOf(v, at);
            return new Temporary(new IrExpr.Unary(u.op(), ir(v, at)), type, at);
        }
        if (e instanceof BinaryExpr b) {
            return b.op().isLogical() ? logical(b, f, out, at) : binary(b, f, out, at);
        }
        if (e instanceof IndexExpr i) {
            return index(i, f, out, at);
        }
        if (e instanceof CallExpr c) {
            return apply(eval(c.callee(), f, out, at), c, f, out, at);
        }
        throw unsupported(at, "Unsupported expression " + e.getClass().getSimpleName());
    }

    private Value binary(BinaryExpr b, Frame f, List<IrStmt> out, Location at) {
        Value l = eval(b.left(), f, out, at);
        Value r = eval(b.right(), f, out, at);
        if (l instanceof ConstantValue lc && r instanceof ConstantValue rc) {
            return ConstantFolder.binary(b.op(), lc, rc, at);
        }
        Type type = TypeUtil.binaryResult(b.op(), typeOf(l, at), typeOf(r, at));
        return new Temporary(new IrExpr.Binary(b.op(), ir(l, at), ir(r, at)), type, at);
    }

    /** Short-circuits on constant operands. */
    private Value logical(BinaryExpr b, Frame f, List<IrStmt> out, Location at) {
        boolean and = b.op() == BinaryExpr.Operator.AND;
        Value l = eval(b.left(), f, out, at);
        if (l instanceof ConstantValue lc) {
            boolean lt = ConstantFolder.truthy(lc);
            if (and && !lt) return BoolValue.FALSE;
            if (!and && lt) return BoolValue.TRUE;
            Value r = eval(b.right(), f, out, at);
            return r instanceof ConstantValue rc ? BoolValue.of(ConstantFolder.truthy(rc)) : r;
        }
        Value r = eval(b.right(), f, out, at);
        if (r instanceof ConstantValue rc) {
            boolean rt = ConstantFolder.truthy(rc);
            if (and) return rt ? l : BoolValue.FALSE;
            return rt ? BoolValue.TRUE : l;
        }
        return new Temporary(new IrExpr.Binary(b.op(), ir(l, at), ir(r, at)), PrimitiveType.BOOL, at);
    }

    private Value index(IndexExpr e, Frame f, List<IrStmt> out, Location at) {
        Value target = eval(e.target(), f, out, at);
        Value idx = eval(e.index(), f, out, at);

        if (target instanceof ConstantValue.DictValue d && idx instanceof ConstantValue.StringValue key) {
            Value v = d.entries().get(key.value());
            if (v == null) throw unsupported(at, "No keyword argument '" + key.value() + "'");
            return v;
        }
        if (!(idx instanceof IntValue iv)) {
            throw unsupported(at, "Index must be a compile-time integer");
        }
        long i = iv.value();
        if (target instanceof ListValue l) {
            long k = i < 0 ? l.size() + i : i;
            if (k < 0 || k >= l.size()) throw unsupported(at, "Index " + i + " out of range for " + l);
            return l.elements().get((int) k);
        }
        if (target instanceof StorageObject o) {
            int width = o.type().width();
            if (width == 0) {
                throw unsupported(at, "Bit select needs a sized type, " + o.name() + " is " + o.type());
            }
            if (i < 0 || i >= width) {
                throw unsupported(at, "Bit " + i + " out of range for " + o.name() + " : " + o.type());
            }
            return new Temporary(new IrExpr.Index(ir(o, at), (int) i), PrimitiveType.BIT, at);
        }
        throw unsupported(at, target + " is not indexable");
    }

    // ---------- helpers ----------

    /** Turns a value into an IR operand and records what it reads. */
    private IrExpr ir(Value v, Location at) {
        if (v instanceof Temporary t && !t.isMaterialized()) return t.expr();
        if (v instanceof StorageObject o) {
            resolver.recordRead(ctx, o);
            return new IrExpr.Ref(o);
        }
        return new IrExpr.Const(hardwareConstant(v, at, "Value " + v));
    }

    private static ConstantValue hardwareConstant(Value v, Location at, String what) {
        if (v instanceof IntValue || v instanceof BoolValue) return (ConstantValue) v;
        throw unsupported(at, what + " is not a constant with a hardware representation");
    }

    private static Type typeOf(Value v, Location at) {
        if (v instanceof StorageObject o) return o.type();
        if (v instanceof IntValue) return PrimitiveType.INTEGER;
        if (v instanceof BoolValue) return PrimitiveType.BOOL;
        throw unsupported(at, "Value " + v + " has no hardware representation");
    }

    private Signal signalNamed(String name, Location at) {
        Binding b = registry.designScope().lookup(name);
        if (b == null || !(b.value() instanceof Signal s)) {
            throw unsupported(at, "'" + name + "' is not a signal");
        }
        resolver.recordRead(ctx, s);
        return s;
    }

    private void requireRuntimeBranching(Location at) {
        if (!ctx.isSequential()) {
            throw unsupported(at, "Runtime branch in concurrent context '" + ctx.name() + "'");
        }
    }

    private void requireSuspension(Location at, String construct) {
        if (!ctx.isSequential()) {
            throw new CompileException(ErrorKind.INVALID_SUSPENSION_CONTEXT, at,
                    "'" + construct + "' in concurrent context '" + ctx.name() + "'");
        }
        if (!ctx.canSuspend()) {
            throw new CompileException(ErrorKind.INVALID_SUSPENSION_CONTEXT, at,
                    "'" + construct + "' in sequential context '" + ctx.name() + "' without a clock");
        }
    }

    private static CompileException unsupported(Location at, String message) {
        return new CompileException(ErrorKind.UNSUPPORTED_CONSTRUCT, at, message);
    }
}
