package cosynth.backend;

import cosynth.ast.expr.BinaryExpr;
import cosynth.ir.IrExpr;
import cosynth.model.AssignMode;
import cosynth.model.Clock;
import cosynth.model.ConstantValue;
import cosynth.model.PortDirection;
import cosynth.model.Reset;
import cosynth.model.Signal;
import cosynth.model.StorageObject;
import cosynth.model.Temporary;
import cosynth.types.PrimitiveType;
import cosynth.types.Type;
import cosynth.types.VectorType;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Reference backend rendering VHDL-flavoured structured text.
 */
public final class TextBackend implements TargetBackend {
    private final StringWriter buffer = new StringWriter();
    private final TextEmitter emitter = new TextEmitter(buffer);

    private String entity;
    private boolean architectureOpen;
    private boolean inProcess;

    @Override
    public void emitEntityBoundary(String entity, List<Signal> ports) {
        this.entity = entity;
        emitter.emitBlockComment("Generated by cosynth");
        emitter.emit("entity %s is", entity);
        emitter.increaseIndentation();
        if (!ports.isEmpty()) {
            emitter.emit("port (");
            emitter.increaseIndentation();
            for (int i = 0; i < ports.size(); i++) {
                Signal p = ports.get(i);
                String sep = i + 1 < ports.size() ? ";" : "";
                emitter.emit("%s : %s %s%s%s", p.name(), direction(p.direction()), type(p.type()), init(p), sep);
            }
            emitter.decreaseIndentation();
            emitter.emit(");");
        }
        emitter.decreaseIndentation();
        emitter.emit("end entity %s;", entity);
        emitter.emitNewLine();
        emitter.emit("architecture cosynth of %s is", entity);
        emitter.increaseIndentation();
    }

    @Override
    public void emitDeclaration(StorageObject object) {
        if (inProcess) {
            emitter.emit("variable %s : %s%s;", object.name(), type(object.type()), init(object));
        } else {
            emitter.emit("signal %s : %s%s;", object.name(), type(object.type()), init(object));
        }
    }

    @Override
    public void emitConcurrentBlock(String id, Runnable body) {
        beginArchitecture();
        emitter.emit("%s : block", id);
        emitter.emit("begin");
        emitter.increaseIndentation();
        body.run();
        emitter.decreaseIndentation();
        emitter.emit("end block %s;", id);
        emitter.emitNewLine();
    }

    @Override
    public void emitProcess(String id, Clock clock, Reset reset, ProcessBody body) {
        beginArchitecture();
        List<String> sensitivity = new ArrayList<>();
        if (clock != null) sensitivity.add(clock.signal().name());
        if (reset != null && reset.async()) sensitivity.add(reset.signal().name());
        if (clock != null && clock.frequency() != null) {
            emitter.emit("-- %s: %d Hz", clock.signal().name(), clock.frequency());
        }
        emitter.emit("%s : process (%s)", id, sensitivity.isEmpty() ? "all" : String.join(", ", sensitivity));

        emitter.increaseIndentation();
        inProcess = true;
        for (StorageObject local : body.locals()) emitDeclaration(local);
        inProcess = false;
        emitter.decreaseIndentation();

        emitter.emit("begin");
        emitter.increaseIndentation();
        Runnable resetBody = reset == null ? null : body.reset();
        if (clock == null) {
            guarded(resetBody, reset, body.body());
        } else if (resetBody != null && reset.async()) {
            emitter.emit("if %s then", resetActive(reset));
            nested(resetBody);
            emitter.emit("elsif %s then", edge(clock));
            nested(body.body());
            emitter.emit("end if;");
        } else {
            emitter.emit("if %s then", edge(clock));
            emitter.increaseIndentation();
            guarded(resetBody, reset, body.body());
            emitter.decreaseIndentation();
            emitter.emit("end if;");
        }
        emitter.decreaseIndentation();
        emitter.emit("end process %s;", id);
        emitter.emitNewLine();
    }

    private void guarded(Runnable resetBody, Reset reset, Runnable body) {
        if (resetBody == null) {
            body.run();
            return;
        }
        emitter.emit("if %s then", resetActive(reset));
        nested(resetBody);
        emitter.emit("else");
        nested(body);
        emitter.emit("end if;");
    }

    @Override
    public void emitAssignment(StorageObject target, IrExpr value, AssignMode mode) {
        String op = mode == AssignMode.VALUE ? ":=" : "<=";
        String rhs = value instanceof IrExpr.Const c ? literal(c.value(), target.type()) : expr(value);
        emitter.emit("%s %s %s;", target.name(), op, rhs);
    }

    @Override
    public void emitConditional(IrExpr condition, Runnable then, Runnable otherwise) {
        emitter.emit("if %s then", expr(condition));
        nested(then);
        if (otherwise != null) {
            emitter.emit("else");
            nested(otherwise);
        }
        emitter.emit("end if;");
    }

    @Override
    public void emitStateSelector(Signal state, List<StateArm> arms) {
        emitter.emit("case %s is", state.name());
        emitter.increaseIndentation();
        for (StateArm arm : arms) {
            emitter.emit("when %d =>", arm.state());
            nested(arm.body());
        }
        emitter.emit("when others =>");
        emitter.increaseIndentation();
        emitter.emit("null;");
        emitter.decreaseIndentation();
        emitter.decreaseIndentation();
        emitter.emit("end case;");
    }

    @Override
    public void emitAssertion(IrExpr condition, String message) {
        if (message == null) {
            emitter.emit("assert %s severity error;", expr(condition));
        } else {
            emitter.emit("assert %s report \"%s\" severity error;", expr(condition), message);
        }
    }

    /** The rendered design. Closes the architecture on first call. */
    public String text() {
        if (entity != null) {
            beginArchitecture();
            emitter.decreaseIndentation();
            emitter.emit("end architecture cosynth;");
            entity = null;
        }
        emitter.flush();
        return buffer.toString();
    }

    // ---------- helpers ----------

    private void beginArchitecture() {
        if (architectureOpen) return;
        architectureOpen = true;
        emitter.decreaseIndentation();
        emitter.emit("begin");
        emitter.increaseIndentation();
    }

    /** Runs {@code body} one level deeper; an empty body becomes {@code null;}. */
    private void nested(Runnable body) {
        emitter.increaseIndentation();
        int before = emitter.lines();
        body.run();
        if (emitter.lines() == before) emitter.emit("null;");
        emitter.decreaseIndentation();
    }

    private static String direction(PortDirection d) {
        return switch (d) {
            case IN -> "in";
            case OUT -> "out";
            case INOUT -> "inout";
        };
    }

    private static String type(Type t) {
        if (t instanceof PrimitiveType p) {
            return switch (p) {
                case BIT -> "bit";
                case BOOL -> "boolean";
                case INTEGER -> "integer";
            };
        }
        VectorType v = (VectorType) t;
        String base = switch (v.kind()) {
            case UNSIGNED -> "unsigned";
            case SIGNED -> "signed";
            case BITVECTOR -> "bit_vector";
        };
        return base + "(" + (v.width() - 1) + " downto 0)";
    }

    private static String init(StorageObject o) {
        if (o instanceof Temporary || !o.hasDefault()) return "";
        return " := " + literal(o.defaultValue(), o.type());
    }

    private static String literal(ConstantValue v, Type type) {
        if (v instanceof ConstantValue.BoolValue b) {
            if (type == PrimitiveType.BIT) return b.value() ? "'1'" : "'0'";
            return b.value() ? "true" : "false";
        }
        long n = ((ConstantValue.IntValue) v).value();
        if (type == PrimitiveType.BIT) return n != 0 ? "'1'" : "'0'";
        if (type == PrimitiveType.BOOL) return n != 0 ? "true" : "false";
        if (type instanceof VectorType vt && vt.kind() == VectorType.Kind.BITVECTOR) {
            StringBuilder bits = new StringBuilder();
            for (int i = vt.width() - 1; i >= 0; i--) bits.append((n >> i & 1) == 1 ? '1' : '0');
            return "\"" + bits + "\"";
        }
        return Long.toString(n);
    }

    private static String edge(Clock clock) {
        String clk = clock.signal().name();
        return switch (clock.edge()) {
            case RISING -> "rising_edge(" + clk + ")";
            case FALLING -> "falling_edge(" + clk + ")";
            case BOTH -> clk + "'event";
        };
    }

    private static String resetActive(Reset reset) {
        return reset.signal().name() + " = " + (reset.activeLow() ? "'0'" : "'1'");
    }

    static String expr(IrExpr e) {
        if (e instanceof IrExpr.Const c) {
            if (c.value() instanceof ConstantValue.BoolValue b) return b.value() ? "true" : "false";
            return c.value().toString();
        }
        if (e instanceof IrExpr.Ref r) return r.target().name();
        if (e instanceof IrExpr.Index i) return expr(i.target()) + "(" + i.index() + ")";
        if (e instanceof IrExpr.Unary u) {
            return switch (u.op()) {
                case NEG -> "-" + expr(u.operand());
                case NOT, INV -> "not " + expr(u.operand());
            };
        }
        IrExpr.Binary b = (IrExpr.Binary) e;
        String l = expr(b.left());
        String r = expr(b.right());
        if (b.op() == BinaryExpr.Operator.SHL) return "shift_left(" + l + ", " + r + ")";
        if (b.op() == BinaryExpr.Operator.SHR) return "shift_right(" + l + ", " + r + ")";
        return "(" + l + " " + operator(b.op()) + " " + r + ")";
    }

    private static String operator(BinaryExpr.Operator op) {
        return switch (op) {
            case ADD -> "+";
            case SUB -> "-";
            case MUL -> "*";
            case DIV -> "/";
            case MOD -> "mod";
            case BIT_AND, AND -> "and";
            case BIT_OR, OR -> "or";
            case BIT_XOR -> "xor";
            case EQ -> "=";
            case NE -> "/=";
            case LT -> "<";
            case GT -> ">";
            case LE -> "<=";
            case GE -> ">=";
            case SHL, SHR -> throw new IllegalStateException("Shifts are rendered as calls");
        };
    }
}
